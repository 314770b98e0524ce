package com.warden.dispatch.api;

import com.warden.core.integrity.IntegrityChecker;
import com.warden.core.integrity.IntegrityViolation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/integrity")
public class IntegrityController {

    private final IntegrityChecker integrityChecker;

    public IntegrityController(IntegrityChecker integrityChecker) {
        this.integrityChecker = integrityChecker;
    }

    /**
     * GET /api/v1/integrity: Verify tracked files against their baseline now.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> verify() {
        List<IntegrityViolation> violations = integrityChecker.verify();
        return ResponseEntity.ok(Map.of(
                "tracked_files", integrityChecker.trackedFiles().size(),
                "intact", violations.isEmpty(),
                "violations", violations));
    }
}
