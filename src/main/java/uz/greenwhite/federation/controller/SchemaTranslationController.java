package uz.greenwhite.federation.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.federation.error.ResourceNotFoundException;
import uz.greenwhite.federation.translation.SchemaTranslationEngine;
import uz.greenwhite.federation.translation.SchemaTranslationRecord;
import uz.greenwhite.federation.translation.SchemaTranslationRequest;
import uz.greenwhite.federation.translation.SchemaTranslationResponse;
import uz.greenwhite.federation.translation.TranslationPerformance;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/schema")
@RequiredArgsConstructor
public class SchemaTranslationController {

    private final SchemaTranslationEngine translationEngine;

    @PostMapping("/translate")
    public ResponseEntity<SchemaTranslationResponse> translate(@RequestBody SchemaTranslationRequest request) {
        return ResponseEntity.ok(translationEngine.translateSchema(request));
    }

    @GetMapping("/translations")
    public ResponseEntity<List<SchemaTranslationRecord>> listTranslations(
            @RequestParam(value = "source_version", required = false) String sourceVersion,
            @RequestParam(value = "target_version", required = false) String targetVersion,
            @RequestParam(value = "client_id", required = false) String clientId) {
        return ResponseEntity.ok(translationEngine.listTranslations(r ->
                (sourceVersion == null || sourceVersion.equals(r.getSourceVersion()))
                        && (targetVersion == null || targetVersion.equals(r.getTargetVersion()))
                        && (clientId == null || clientId.equals(r.getClientId()))));
    }

    @GetMapping("/translations/{id}")
    public ResponseEntity<SchemaTranslationRecord> getTranslation(@PathVariable UUID id) {
        return ResponseEntity.ok(translationEngine.getTranslation(id)
                .orElseThrow(() -> new ResourceNotFoundException("Translation", id)));
    }

    @GetMapping("/performance")
    public ResponseEntity<List<TranslationPerformance>> performance() {
        return ResponseEntity.ok(translationEngine.performance());
    }
}
