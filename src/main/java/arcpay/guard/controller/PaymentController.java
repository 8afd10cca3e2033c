package arcpay.guard.controller;

import arcpay.guard.dto.PaymentReceipt;
import arcpay.guard.dto.PaymentRequest;
import arcpay.guard.service.payment.PaymentOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentOrchestrator orchestrator;

    @PostMapping("/execute")
    public ResponseEntity<PaymentReceipt> execute(@RequestBody @Valid PaymentRequest request) {
        return ResponseEntity.ok(orchestrator.execute(request));
    }
}
