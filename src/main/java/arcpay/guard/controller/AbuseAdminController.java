package arcpay.guard.controller;

import arcpay.guard.dto.BlockRequest;
import arcpay.guard.service.abuse.AbuseSnapshot;
import arcpay.guard.service.abuse.AbuseTrackerService;
import arcpay.guard.service.abuse.ClientIdentity;
import jakarta.validation.Valid;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of the abuse tracker. Loopback only (see LocalhostOnlyFilter).
 */
@RestController
@RequestMapping("/admin/abuse")
@RequiredArgsConstructor
public class AbuseAdminController {

    private final AbuseTrackerService abuseTracker;

    @GetMapping
    public ResponseEntity<AbuseSnapshot> status(
        @RequestParam String ip,
        @RequestParam(required = false) String userId
    ) {
        return ResponseEntity.ok(abuseTracker.snapshot(new ClientIdentity(ip, userId)));
    }

    @PostMapping("/block")
    public ResponseEntity<AbuseSnapshot> block(@RequestBody @Valid BlockRequest request) {
        ClientIdentity identity = new ClientIdentity(request.getIp(), request.getUserId());
        Duration duration = request.getDurationSeconds() == null
            ? null
            : Duration.ofSeconds(request.getDurationSeconds());
        abuseTracker.block(identity, duration);
        return ResponseEntity.ok(abuseTracker.snapshot(identity));
    }

    @PostMapping("/unblock")
    public ResponseEntity<AbuseSnapshot> unblock(@RequestBody @Valid BlockRequest request) {
        ClientIdentity identity = new ClientIdentity(request.getIp(), request.getUserId());
        abuseTracker.unblock(identity);
        return ResponseEntity.ok(abuseTracker.snapshot(identity));
    }
}
