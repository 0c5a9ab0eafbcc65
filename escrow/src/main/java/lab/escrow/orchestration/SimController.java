package lab.escrow.orchestration;

import lab.escrow.sim.fakeledger.FakeAssetLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/sim/ledger")
public class SimController {

    private final FakeAssetLedger fakeAssetLedger;

    // Give a participant test funds so escrow scenarios can run without a real ledger.
    @PostMapping("/{asset}/mint")
    public Map<String, Object> mint(@PathVariable String asset, @RequestBody MintRequest req) {
        long balance = fakeAssetLedger.mint(asset, req.holder(), req.amount());
        return Map.of("asset", asset, "holder", req.holder(), "balance", balance);
    }

    // Payers approve the factory address before calling POST /escrows.
    @PostMapping("/{asset}/approve")
    public Map<String, Object> approve(@PathVariable String asset, @RequestBody ApproveRequest req) {
        fakeAssetLedger.approve(asset, req.owner(), req.spender(), req.amount());
        return Map.of(
                "asset", asset,
                "owner", req.owner(),
                "spender", req.spender(),
                // approve stores trimmed identities
                "allowance", fakeAssetLedger.allowance(asset.trim(), req.owner().trim(), req.spender().trim())
        );
    }

    @GetMapping("/{asset}/balances/{holder}")
    public Map<String, Object> balance(@PathVariable String asset, @PathVariable String holder) {
        return Map.of("asset", asset, "holder", holder, "balance", fakeAssetLedger.balanceOf(asset, holder));
    }

    public record MintRequest(String holder, long amount) {}

    public record ApproveRequest(String owner, String spender, long amount) {}
}
