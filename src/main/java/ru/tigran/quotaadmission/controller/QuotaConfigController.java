package ru.tigran.quotaadmission.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.quotaadmission.dto.QuotaConfig;
import ru.tigran.quotaadmission.dto.QuotaConfigRequest;
import ru.tigran.quotaadmission.service.QuotaConfigService;

/**
 * REST API настройки квот исследования.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/quotas/{researchId}/config")
@Tag(name = "Quota configuration", description = "Настройка правил квот исследования")
public class QuotaConfigController {

    private final QuotaConfigService quotaConfigService;

    public QuotaConfigController(QuotaConfigService quotaConfigService) {
        this.quotaConfigService = quotaConfigService;
    }

    @PutMapping
    @Operation(
            summary = "Создать или заменить конфигурацию квот",
            description = "Полностью заменяет правила исследования. Счётчики не меняются."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Конфигурация сохранена",
                    content = @Content(schema = @Schema(implementation = QuotaConfig.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неверные правила (отрицательный cap, пустое значение, дубликаты)"
            )
    })
    public ResponseEntity<QuotaConfig> saveConfig(
            @PathVariable String researchId,
            @Valid @RequestBody QuotaConfigRequest request
    ) {
        log.info("PUT /api/v1/quotas/{}/config - rules: {}, mode: {}",
                researchId, request.rules().size(), request.combinationMode());
        return ResponseEntity.ok(quotaConfigService.saveConfig(researchId, request));
    }

    @GetMapping
    @Operation(summary = "Получить конфигурацию квот")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Конфигурация найдена",
                    content = @Content(schema = @Schema(implementation = QuotaConfig.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Для исследования квоты не настроены"
            )
    })
    public ResponseEntity<QuotaConfig> getConfig(@PathVariable String researchId) {
        log.info("GET /api/v1/quotas/{}/config", researchId);
        return ResponseEntity.ok(quotaConfigService.getConfig(researchId));
    }
}
