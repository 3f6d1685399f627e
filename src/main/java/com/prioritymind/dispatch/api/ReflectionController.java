package com.prioritymind.dispatch.api;

import com.prioritymind.core.model.Reflection;
import com.prioritymind.core.session.ReflectionNotFoundException;
import com.prioritymind.core.session.ReflectionService;
import com.prioritymind.core.session.ReflectionView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for a session's reflections.
 */
@RestController
@RequestMapping("/api/v1/sessions/{id}/reflections")
public class ReflectionController {

    private final ReflectionService reflectionService;

    public ReflectionController(ReflectionService reflectionService) {
        this.reflectionService = reflectionService;
    }

    @GetMapping
    public ResponseEntity<List<ReflectionView>> list(@PathVariable String id) {
        return ResponseEntity.ok(reflectionService.list(id));
    }

    @PostMapping
    public ResponseEntity<?> create(@PathVariable String id, @RequestBody ReflectionRequest request) {
        try {
            Reflection created = reflectionService.create(id, request.text());
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "id", created.id(),
                    "text", created.text(),
                    "created_at", created.createdAt(),
                    "is_active", created.active()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/sessions/{id}/reflections/{rid}/toggle; the body is optional.
     */
    @PostMapping("/{rid}/toggle")
    public ResponseEntity<?> toggle(@PathVariable String id, @PathVariable String rid,
                                    @RequestBody(required = false) ReflectionRequest request) {
        try {
            Reflection toggled = reflectionService.toggle(id, rid, request == null ? null : request.active());
            return ResponseEntity.ok(Map.of("id", toggled.id(), "is_active", toggled.active()));
        } catch (ReflectionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
