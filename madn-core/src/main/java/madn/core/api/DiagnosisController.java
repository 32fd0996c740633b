package madn.core.api;

import madn.core.api.model.DecisionBundle;
import madn.core.api.model.DiagnosisRequest;
import madn.core.audit.AuditEntry;
import madn.core.audit.ChainVerification;
import madn.core.service.DiagnosisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class DiagnosisController {
    private final DiagnosisService service;

    public DiagnosisController(DiagnosisService service) {
        this.service = service;
    }

    @PostMapping("/diagnose")
    public ResponseEntity<DecisionBundle> diagnose(@RequestBody DiagnosisRequest request) {
        return ResponseEntity.ok(service.diagnose(request));
    }

    @GetMapping("/audit/verify")
    public ResponseEntity<List<ChainVerification>> verify() {
        return ResponseEntity.ok(service.verifyAudit());
    }

    @GetMapping("/audit/cases/{caseId}")
    public ResponseEntity<List<AuditEntry>> auditTrail(@PathVariable String caseId) {
        return ResponseEntity.ok(service.auditTrail(caseId));
    }
}
