package com.phillippitts.multiroomaudio.presentation.controller;

import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.PlayerConfigMapper;
import com.phillippitts.multiroomaudio.presentation.dto.OffsetRequest;
import com.phillippitts.multiroomaudio.presentation.dto.PlayerRequest;
import com.phillippitts.multiroomaudio.presentation.dto.ResultBodies;
import com.phillippitts.multiroomaudio.presentation.dto.VolumeRequest;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Player CRUD, lifecycle, volume and sync offset.
 */
@RestController
@RequestMapping("/api/players")
class PlayerController {

    private static final Logger LOG = LogManager.getLogger(PlayerController.class);

    private final PlayerOrchestrator orchestrator;

    PlayerController(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    Map<String, Object> listPlayers() {
        Map<String, Object> players = new LinkedHashMap<>();
        orchestrator.players().forEach((name, config) -> players.put(name, PlayerConfigMapper.toMap(config)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("players", players);
        body.put("statuses", orchestrator.getAllStatuses());
        return body;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> createPlayer(@RequestBody PlayerRequest request) {
        LOG.info("Create player requested: name={}, provider={}", request.getName(), request.getProvider());
        OperationResult result = orchestrator.createPlayer(request.toDefinition(null));
        return respond(result, HttpStatus.BAD_REQUEST);
    }

    @GetMapping("/{name}")
    ResponseEntity<Map<String, Object>> getPlayer(@PathVariable String name) {
        Optional<PlayerConfig> config = orchestrator.getPlayer(name);
        return config
                .map(c -> ResponseEntity.ok(PlayerConfigMapper.toMap(c)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ResultBodies.of(OperationResult.failure(PlayerOrchestrator.PLAYER_NOT_FOUND))));
    }

    @PutMapping("/{name}")
    ResponseEntity<Map<String, Object>> updatePlayer(@PathVariable String name, @RequestBody PlayerRequest request) {
        LOG.info("Update player requested: name={}, newName={}", name, request.getName());
        OperationResult result = orchestrator.updatePlayer(name, request.toDefinition(name));
        if (!result.success() && PlayerOrchestrator.PLAYER_NOT_FOUND.equals(result.message())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ResultBodies.of(result));
        }
        return respond(result, HttpStatus.BAD_REQUEST);
    }

    @DeleteMapping("/{name}")
    ResponseEntity<Map<String, Object>> deletePlayer(@PathVariable String name) {
        OperationResult result = orchestrator.deletePlayer(name);
        HttpStatus failureStatus = PlayerOrchestrator.PLAYER_NOT_FOUND.equals(result.message())
                ? HttpStatus.NOT_FOUND : HttpStatus.INTERNAL_SERVER_ERROR;
        return respond(result, failureStatus);
    }

    @PostMapping("/{name}/start")
    Map<String, Object> startPlayer(@PathVariable String name) {
        return ResultBodies.withMessage(orchestrator.startPlayer(name));
    }

    @PostMapping("/{name}/stop")
    Map<String, Object> stopPlayer(@PathVariable String name) {
        return ResultBodies.withMessage(orchestrator.stopPlayer(name));
    }

    @GetMapping("/{name}/status")
    Map<String, Object> getStatus(@PathVariable String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", orchestrator.getPlayerStatus(name));
        body.put("degraded", orchestrator.isDegraded(name));
        return body;
    }

    @GetMapping("/{name}/volume")
    ResponseEntity<Map<String, Object>> getVolume(@PathVariable String name) {
        Optional<Integer> volume = orchestrator.getPlayerVolume(name);
        if (volume.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ResultBodies.withMessage(OperationResult.failure(PlayerOrchestrator.PLAYER_NOT_FOUND)));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("volume", volume.get());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{name}/volume")
    Map<String, Object> setVolume(@PathVariable String name, @Valid @RequestBody VolumeRequest request) {
        return ResultBodies.withMessage(orchestrator.setPlayerVolume(name, request.volume()));
    }

    @PutMapping("/{name}/offset")
    ResponseEntity<Map<String, Object>> updateOffset(@PathVariable String name,
                                                     @Valid @RequestBody OffsetRequest request) {
        OperationResult result = orchestrator.updatePlayerOffset(name, request.delayMs());
        Map<String, Object> body = ResultBodies.withMessage(result);
        if (result.success()) {
            body.put("delay_ms", request.delayMs());
            body.put("restart_required", true);
            return ResponseEntity.ok(body);
        }
        HttpStatus status = PlayerOrchestrator.PLAYER_NOT_FOUND.equals(result.message())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body);
    }

    private static ResponseEntity<Map<String, Object>> respond(OperationResult result, HttpStatus failureStatus) {
        return result.success()
                ? ResponseEntity.ok(ResultBodies.of(result))
                : ResponseEntity.status(failureStatus).body(ResultBodies.of(result));
    }
}
