package com.flagship.credit_ledger.asset;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetRegistry assetRegistry;

    @GetMapping
    public List<AssetType> listAssets() {
        return assetRegistry.findAll();
    }
}
