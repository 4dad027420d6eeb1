package com.phillippitts.multiroomaudio;

import com.phillippitts.multiroomaudio.config.properties.AudioProperties;
import com.phillippitts.multiroomaudio.config.properties.PlayerStoreProperties;
import com.phillippitts.multiroomaudio.config.properties.ProcessSupervisorProperties;
import com.phillippitts.multiroomaudio.config.properties.StatusMonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ProcessSupervisorProperties.class,
        PlayerStoreProperties.class,
        StatusMonitorProperties.class,
        AudioProperties.class
})
@EnableScheduling
public class MultiRoomAudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiRoomAudioApplication.class, args);
    }

}
