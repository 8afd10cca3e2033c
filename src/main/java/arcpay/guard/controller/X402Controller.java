package arcpay.guard.controller;

import arcpay.guard.dto.IntentReceipt;
import arcpay.guard.dto.SignedIntent;
import arcpay.guard.service.intent.X402IntentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/x402")
@RequiredArgsConstructor
public class X402Controller {

    private final X402IntentService intentService;

    @PostMapping("/execute")
    public ResponseEntity<IntentReceipt> execute(@RequestBody @Valid SignedIntent intent) {
        return ResponseEntity.ok(intentService.execute(intent));
    }
}
