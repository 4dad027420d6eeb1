package com.phillippitts.multiroomaudio.presentation.controller;

import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PortAudioDevice;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;
import com.phillippitts.multiroomaudio.presentation.dto.ResultBodies;
import com.phillippitts.multiroomaudio.presentation.dto.TestToneRequest;
import com.phillippitts.multiroomaudio.presentation.dto.VolumeRequest;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Audio output devices: listing, sendspin outputs, mixer controls, hardware volume and test tone.
 */
@RestController
@RequestMapping("/api/devices")
class DeviceController {

    private static final Logger LOG = LogManager.getLogger(DeviceController.class);

    private final PlayerOrchestrator orchestrator;

    DeviceController(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    Map<String, List<AudioDevice>> listDevices() {
        List<AudioDevice> devices = orchestrator.getAudioDevices();
        LOG.debug("Returning {} audio devices", devices.size());
        return Map.of("devices", devices);
    }

    @GetMapping("/{id}/mixer-controls")
    Map<String, List<String>> mixerControls(@PathVariable String id) {
        return Map.of("controls", orchestrator.getMixerControls(id));
    }

    /** Sendspin's PortAudio outputs, or PulseAudio sinks when configured as fallback. */
    @GetMapping("/portaudio")
    Map<String, Object> portAudioDevices() {
        PortAudioListing listing = orchestrator.getPortAudioDevices();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", listing.success());
        body.put("devices", listing.devices().stream().map(DeviceController::portAudioEntry).toList());
        if (listing.rawOutput() != null) {
            body.put("raw_output", listing.rawOutput());
        }
        putIfPresent(body, "note", listing.note());
        putIfPresent(body, "fallback", listing.fallback());
        putIfPresent(body, "stderr", listing.stderr());
        putIfPresent(body, "message", listing.message());
        LOG.debug("Returning {} PortAudio devices", listing.devices().size());
        return body;
    }

    @GetMapping("/{id}/volume")
    ResponseEntity<Map<String, Object>> getVolume(@PathVariable String id,
                                                  @RequestParam(name = "control", defaultValue = "") String control) {
        OptionalInt volume = orchestrator.getDeviceVolume(id, control);
        if (volume.isEmpty()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ResultBodies.withMessage(OperationResult.failure("Cannot read volume of " + id)));
        }
        return ResponseEntity.ok(Map.of("device", id, "volume", volume.getAsInt()));
    }

    @PostMapping("/{id}/volume")
    Map<String, Object> setVolume(@PathVariable String id,
                                  @RequestParam(name = "control", defaultValue = "") String control,
                                  @Valid @RequestBody VolumeRequest request) {
        return ResultBodies.withMessage(orchestrator.setDeviceVolume(id, request.volume(), control));
    }

    @PostMapping("/test-tone")
    ResponseEntity<Map<String, Object>> testTone(@Valid @RequestBody TestToneRequest request) {
        OperationResult result = orchestrator.playTestTone(request.device());
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(ResultBodies.withMessage(result));
    }

    private static Map<String, Object> portAudioEntry(PortAudioDevice device) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("index", device.index());
        entry.put("name", device.name());
        entry.put("raw", device.raw());
        if (device.isPulseAudio()) {
            entry.put("type", device.type());
        }
        return entry;
    }

    private static void putIfPresent(Map<String, Object> body, String key, String value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
