package com.phillippitts.multiroomaudio.service.audio;

import com.phillippitts.multiroomaudio.config.properties.AudioProperties;
import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PortAudioDevice;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;
import com.phillippitts.multiroomaudio.exception.DeviceCommandException;
import com.phillippitts.multiroomaudio.service.process.CommandResult;
import com.phillippitts.multiroomaudio.service.process.CommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AlsaAudioDeviceServiceTest {

    private CommandRunner runner;
    private AlsaAudioDeviceService service;

    @BeforeEach
    void setUp() {
        runner = mock(CommandRunner.class);
        service = new AlsaAudioDeviceService(runner, new AudioProperties());
    }

    private static CommandResult ok(String stdout) {
        return new CommandResult(0, stdout, "", false);
    }

    @Test
    void devicesAlwaysStartWithDefaultAndNull() {
        when(runner.run(eq(List.of("aplay", "-l")), any(Duration.class))).thenReturn(ok(
                "card 1: Device [USB Audio Device], device 0: USB Audio [USB Audio]\n"));

        assertThat(service.getDevices()).extracting(AudioDevice::id)
                .containsExactly("default", "null", "hw:1,0");
    }

    @Test
    void devicesSurviveMissingAplay() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenThrow(new DeviceCommandException(List.of("aplay"), new IOException("error=2")));

        assertThat(service.getDevices()).extracting(AudioDevice::id).containsExactly("default", "null");
    }

    @Test
    void amixerAddressesCardOfHardwareDevices() {
        assertThat(AlsaAudioDeviceService.amixer("default")).containsExactly("amixer");
        assertThat(AlsaAudioDeviceService.amixer("hw:1,0")).containsExactly("amixer", "-c", "1");
        assertThat(AlsaAudioDeviceService.amixer("plughw:CARD=Device,DEV=0")).containsExactly("amixer", "-c", "Device");
        assertThat(AlsaAudioDeviceService.amixer("dmix")).containsExactly("amixer", "-D", "dmix");
    }

    @Test
    void setVolumeUsesConfiguredDefaultControl() {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ok(""));

        OperationResult result = service.setVolume("hw:1,0", 40, "");

        assertThat(result).isEqualTo(OperationResult.ok("Volume set to 40%"));
        verify(runner).run(eq(List.of("amixer", "-c", "1", "sset", "Master", "40%")), any(Duration.class));
    }

    @Test
    void setVolumeRejectsBadInputWithoutRunningAnything() {
        assertThat(service.setVolume("hw:1,0", 101, "PCM").message()).isEqualTo("Volume must be between 0 and 100");
        assertThat(service.setVolume("hw:1,0; rm -rf /", 50, "PCM").message())
                .isEqualTo("Invalid device identifier: hw:1,0; rm -rf /");
        assertThat(service.setVolume("null", 50, "PCM").message()).isEqualTo("Device 'null' has no mixer");
        assertThat(service.setVolume("hw:1,0", 50, "PCM'").message()).isEqualTo("Invalid mixer control: PCM'");
        verifyNoInteractions(runner);
    }

    @Test
    void setVolumeReportsToolFailure() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenReturn(new CommandResult(1, "", "amixer: Unable to find simple control 'Master',0\n", false));

        OperationResult result = service.setVolume("hw:1,0", 40, null);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith("Failed to set volume: amixer: Unable to find simple control");
    }

    @Test
    void getVolumeParsesPercentAndIsEmptyOnFailure() {
        when(runner.run(eq(List.of("amixer", "-c", "1", "sget", "PCM")), any(Duration.class)))
                .thenReturn(ok("  Front Left: Playback 49 [62%] [-19.50dB] [on]\n"));
        when(runner.run(eq(List.of("amixer", "-c", "2", "sget", "Master")), any(Duration.class)))
                .thenReturn(new CommandResult(1, "", "no such card", false));

        assertThat(service.getVolume("hw:1,0", "PCM")).isEqualTo(OptionalInt.of(62));
        assertThat(service.getVolume("hw:2,0", "")).isEmpty();
        assertThat(service.getVolume("null", "")).isEmpty();
    }

    @Test
    void getVolumeIsEmptyWhenAmixerIsMissing() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenThrow(new DeviceCommandException(List.of("amixer"), new IOException("error=2")));

        assertThat(service.getVolume("hw:1,0", "PCM")).isEmpty();
    }

    @Test
    void portAudioDevicesAreParsedFromStdout() {
        when(runner.run(eq(List.of("sendspin", "--list-audio-devices")), eq(Duration.ofSeconds(10))))
                .thenReturn(ok("Available audio devices:\n[0] HDA Intel PCH: ALC892 Analog\n[1] USB Audio Device\n"));

        PortAudioListing listing = service.getPortAudioDevices();

        assertThat(listing.success()).isTrue();
        assertThat(listing.devices()).extracting(PortAudioDevice::index).containsExactly("0", "1");
        assertThat(listing.devices().get(1).name()).isEqualTo("USB Audio Device");
        assertThat(listing.note()).isEqualTo(AlsaAudioDeviceService.PORTAUDIO_NOTE);
        assertThat(listing.fallback()).isNull();
    }

    @Test
    void portAudioDevicesFallBackToStderrListing() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenReturn(new CommandResult(0, "", "[0] default\n", false));

        assertThat(service.getPortAudioDevices().devices()).extracting(PortAudioDevice::name).containsExactly("default");
    }

    @Test
    void portAudioListingWithOnlyErrorsIsUnsuccessful() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenReturn(new CommandResult(1, "", "PortAudio: no host API\n", false));

        PortAudioListing listing = service.getPortAudioDevices();

        assertThat(listing.success()).isFalse();
        assertThat(listing.stderr()).contains("no host API");
        assertThat(listing.message()).isEqualTo("No devices found. Check stderr for errors.");
    }

    @Test
    void portAudioListingReportsMissingBinaryAndTimeout() {
        when(runner.run(anyList(), any(Duration.class)))
                .thenThrow(new DeviceCommandException(List.of("sendspin"), new IOException("error=2")))
                .thenReturn(new CommandResult(-1, "", "", true));

        assertThat(service.getPortAudioDevices()).isEqualTo(PortAudioListing.failure("sendspin binary not found"));
        assertThat(service.getPortAudioDevices()).isEqualTo(PortAudioListing.failure("Timeout listing audio devices"));
    }

    @Test
    void pulseSinksStandInWhenFallbackIsEnabled() {
        AudioProperties props = new AudioProperties();
        props.setPulseaudioFallback(true);
        AlsaAudioDeviceService pulse = new AlsaAudioDeviceService(runner, props);
        when(runner.run(eq(List.of("sendspin", "--list-audio-devices")), any(Duration.class))).thenReturn(ok(""));
        when(runner.run(eq(List.of("pactl", "list", "sinks", "short")), any(Duration.class)))
                .thenReturn(ok("0\talsa_output.pci-0000_00_1f.3.analog-stereo\tmodule-alsa-card.c\ts16le 2ch 44100Hz\tSUSPENDED\n"));

        PortAudioListing listing = pulse.getPortAudioDevices();

        assertThat(listing.success()).isTrue();
        assertThat(listing.fallback()).isEqualTo("pulseaudio");
        assertThat(listing.note()).isEqualTo(AlsaAudioDeviceService.PULSEAUDIO_NOTE);
        assertThat(listing.devices()).singleElement()
                .extracting(PortAudioDevice::name).isEqualTo("alsa_output.pci-0000_00_1f.3.analog-stereo");
    }

    @Test
    void pulseSinksAreNotQueriedByDefault() {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ok(""));

        assertThat(service.getPortAudioDevices().devices()).isEmpty();
        verify(runner, never()).run(eq(List.of("pactl", "list", "sinks", "short")), any(Duration.class));
    }

    @Test
    void diagnosticsCollectToolOutputAndHardwareControls() {
        when(runner.run(eq(List.of("aplay", "-l")), any(Duration.class))).thenReturn(ok(
                "card 1: Device [USB Audio Device], device 0: USB Audio [USB Audio]\n"));
        when(runner.run(eq(List.of("amixer")), any(Duration.class)))
                .thenThrow(new DeviceCommandException(List.of("amixer"), new IOException("error=2")));
        when(runner.run(eq(List.of("amixer", "-c", "1", "scontrols")), any(Duration.class)))
                .thenReturn(ok("Simple mixer control 'PCM',0\n"));

        AudioDiagnostics diagnostics = service.diagnostics();

        assertThat(diagnostics.detectedDevices()).extracting(AudioDevice::id).containsExactly("default", "null", "hw:1,0");
        assertThat(diagnostics.aplayAvailable()).isTrue();
        assertThat(diagnostics.aplayOutput()).contains("USB Audio Device");
        assertThat(diagnostics.amixerAvailable()).isFalse();
        assertThat(diagnostics.mixerControls()).containsOnlyKeys("hw:1,0");
        assertThat(diagnostics.mixerControls().get("hw:1,0")).containsExactly("PCM");
    }

    @Test
    void mixerControlsOfNullDeviceAreEmpty() {
        assertThat(service.getMixerControls("null")).isEmpty();
        verifyNoInteractions(runner);
    }

    @Test
    void testToneReportsTimeout() {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(new CommandResult(-1, "", "", true));

        assertThat(service.playTestTone("hw:1,0").message()).isEqualTo("Test tone on hw:1,0 timed out");
    }

    @Test
    void testToneSucceeds() {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ok(""));

        OperationResult result = service.playTestTone("hw:1,0");

        assertThat(result.success()).isTrue();
        verify(runner).run(eq(List.of("speaker-test", "-D", "hw:1,0", "-c", "2", "-t", "sine", "-f", "440", "-l", "1")),
                eq(Duration.ofSeconds(10)));
    }
}
