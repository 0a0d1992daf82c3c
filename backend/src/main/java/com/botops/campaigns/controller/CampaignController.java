package com.botops.campaigns.controller;

import com.botops.campaigns.dto.CampaignResponse;
import com.botops.campaigns.dto.CreateCampaignRequest;
import com.botops.campaigns.dto.RecipientResponse;
import com.botops.campaigns.service.CampaignService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/campaigns")
public class CampaignController {

    private final CampaignService campaignService;

    public CampaignController(CampaignService campaignService) {
        this.campaignService = campaignService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CampaignResponse create(@Valid @RequestBody CreateCampaignRequest request) {
        return campaignService.create(request);
    }

    @GetMapping
    public List<CampaignResponse> list(@RequestParam String tenantId) {
        return campaignService.list(tenantId);
    }

    @GetMapping("/{campaignId}")
    public CampaignResponse get(@PathVariable UUID campaignId, @RequestParam String tenantId) {
        return campaignService.get(tenantId, campaignId);
    }

    @PostMapping("/{campaignId}/activate")
    public CampaignResponse activate(@PathVariable UUID campaignId, @RequestParam String tenantId) {
        return campaignService.activate(tenantId, campaignId);
    }

    @PostMapping("/{campaignId}/pause")
    public CampaignResponse pause(@PathVariable UUID campaignId, @RequestParam String tenantId) {
        return campaignService.pause(tenantId, campaignId);
    }

    @GetMapping("/{campaignId}/recipients")
    public List<RecipientResponse> recipients(@PathVariable UUID campaignId,
                                              @RequestParam String tenantId,
                                              @RequestParam(defaultValue = "100") int limit) {
        return campaignService.recipients(tenantId, campaignId, limit);
    }
}
