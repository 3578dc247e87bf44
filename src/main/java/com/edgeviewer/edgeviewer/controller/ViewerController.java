package com.edgeviewer.edgeviewer.controller;

import com.edgeviewer.edgeviewer.model.dto.FrameStats;
import com.edgeviewer.edgeviewer.model.dto.ModeRequest;
import com.edgeviewer.edgeviewer.service.viewer.EdgeViewerService;
import com.edgeviewer.edgeviewer.service.viewer.PipelineState;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Viewer Controller
 *
 * Endpoints:
 * - POST /viewer/start - Start capture
 * - POST /viewer/stop - Stop capture and return session statistics
 * - GET /viewer/status - Pipeline state and counters
 * - GET /viewer/stats - Live frame statistics
 * - POST /viewer/mode - Switch between raw and edge display
 * - GET /viewer/frame - Last rendered frame as JPEG or PNG
 */
@RestController
@RequestMapping("/viewer")
@CrossOrigin(origins = "*")
public class ViewerController {

    static final String PLACEHOLDER = "Waiting for frames...";

    @Autowired
    private EdgeViewerService viewerService;

    /**
     * POST /viewer/start
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        Map<String, Object> response = new HashMap<>();

        PipelineState state = viewerService.start();
        response.put("state", state.name());

        if (state == PipelineState.CAPTURING) {
            response.put("success", true);
            response.put("message", "Capture running");
            return ResponseEntity.ok(response);
        }

        response.put("success", false);
        response.put("error", viewerService.getErrorMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    /**
     * POST /viewer/stop
     */
    @PostMapping("/stop")
    public Map<String, Object> stop() {
        Map<String, Object> response = new HashMap<>();

        Map<String, Object> stats = viewerService.stop();
        if (stats != null) {
            response.put("success", true);
            response.put("message", "Capture stopped");
            response.put("statistics", stats);
        } else {
            response.put("success", false);
            response.put("message", "No active capture session");
        }

        return response;
    }

    /**
     * GET /viewer/status
     */
    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        return viewerService.getStatus();
    }

    /**
     * GET /viewer/stats
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> response = new HashMap<>();

        if (viewerService.getState() == PipelineState.UNAVAILABLE) {
            response.put("available", false);
            response.put("text", viewerService.getErrorMessage());
            return response;
        }

        Optional<FrameStats> stats = viewerService.currentStats();
        response.put("available", stats.isPresent());
        if (stats.isPresent()) {
            FrameStats s = stats.get();
            response.put("fps", s.getFps());
            response.put("width", s.getWidth());
            response.put("height", s.getHeight());
            response.put("mode", s.getMode());
            response.put("text", s.getText());
        } else {
            response.put("text", PLACEHOLDER);
        }

        return response;
    }

    /**
     * POST /viewer/mode
     * {
     *   "showRaw": true
     * }
     */
    @PostMapping("/mode")
    public ResponseEntity<Map<String, Object>> setMode(@Valid @RequestBody ModeRequest request) {
        Map<String, Object> response = new HashMap<>();

        try {
            viewerService.setShowRaw(request.getShowRaw());
            response.put("success", true);
            response.put("showRaw", request.getShowRaw());
            return ResponseEntity.ok(response);
        } catch (IllegalStateException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
    }

    /**
     * GET /viewer/frame?format=jpeg
     */
    @GetMapping("/frame")
    public ResponseEntity<byte[]> getFrame(@RequestParam(defaultValue = "jpeg") String format) {
        MediaType mediaType;
        switch (format.toLowerCase()) {
            case "jpeg":
            case "jpg":
                format = "jpeg";
                mediaType = MediaType.IMAGE_JPEG;
                break;
            case "png":
                format = "png";
                mediaType = MediaType.IMAGE_PNG;
                break;
            default:
                return ResponseEntity.badRequest().build();
        }

        Optional<byte[]> image = viewerService.renderedFrame(format);
        if (image.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok().contentType(mediaType).body(image.get());
    }
}
