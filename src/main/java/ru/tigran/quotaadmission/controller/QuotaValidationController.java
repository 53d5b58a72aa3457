package ru.tigran.quotaadmission.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.quotaadmission.dto.QuotaResetRequest;
import ru.tigran.quotaadmission.dto.QuotaResetResponse;
import ru.tigran.quotaadmission.dto.QuotaStatsResponse;
import ru.tigran.quotaadmission.dto.QuotaValidationRequest;
import ru.tigran.quotaadmission.dto.ValidationResult;
import ru.tigran.quotaadmission.dto.ValidationStatus;
import ru.tigran.quotaadmission.service.AdmissionControlService;
import ru.tigran.quotaadmission.service.QuotaResetService;
import ru.tigran.quotaadmission.service.QuotaStatsService;

/**
 * REST API допуска участников по квотам исследования.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/quotas")
@Tag(name = "Quotas", description = "Проверка участников по квотам, статистика и сброс счётчиков")
public class QuotaValidationController {

    private final AdmissionControlService admissionControlService;
    private final QuotaStatsService quotaStatsService;
    private final QuotaResetService quotaResetService;

    public QuotaValidationController(
            AdmissionControlService admissionControlService,
            QuotaStatsService quotaStatsService,
            QuotaResetService quotaResetService
    ) {
        this.admissionControlService = admissionControlService;
        this.quotaStatsService = quotaStatsService;
        this.quotaResetService = quotaResetService;
    }

    /**
     * Проверить участника и, если он допущен, учесть его во всех подходящих ячейках.
     *
     * @param request researchId и демография участника
     * @return решение; ERROR отдаётся со статусом 503
     */
    @PostMapping("/validate")
    @Operation(
            summary = "Проверить участника по квотам",
            description = "Атомарно учитывает участника во всех подходящих ячейках. " +
                    "Если хотя бы одна ячейка заполнена, участник отклоняется и счётчики не меняются."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Решение принято: QUALIFIED, NO_CONFIG или OVERQUOTA",
                    content = @Content(schema = @Schema(implementation = ValidationResult.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Отсутствует researchId или demographics не является объектом"
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Решение ERROR: хранилище счётчиков или конфигураций недоступно",
                    content = @Content(schema = @Schema(implementation = ValidationResult.class))
            )
    })
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody QuotaValidationRequest request) {
        log.info("POST /api/v1/quotas/validate - research: {}", request.researchId());

        ValidationResult result = admissionControlService.validate(request.researchId(), request.demographics());

        if (result.status() == ValidationStatus.ERROR) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Получить заполнение квот исследования.
     *
     * @param researchId ID исследования
     * @return QuotaStatsResponse
     */
    @GetMapping("/{researchId}/stats")
    @Operation(
            summary = "Статистика квот",
            description = "Текущее заполнение каждой ячейки исследования. Снимок без блокировок."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Статистика получена",
                    content = @Content(schema = @Schema(implementation = QuotaStatsResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Хранилище счётчиков недоступно"
            )
    })
    public ResponseEntity<QuotaStatsResponse> getStats(@PathVariable String researchId) {
        log.info("GET /api/v1/quotas/{}/stats", researchId);
        return ResponseEntity.ok(quotaStatsService.getStats(researchId));
    }

    /**
     * Обнулить все счётчики исследования.
     *
     * @param request researchId и подтверждение confirmReset = true
     * @return QuotaResetResponse
     */
    @PostMapping("/reset")
    @Operation(
            summary = "Сбросить счётчики квот",
            description = "Обнуляет все счётчики исследования. Требует confirmReset = true. " +
                    "Конфигурация квот не меняется."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Счётчики сброшены",
                    content = @Content(schema = @Schema(implementation = QuotaResetResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Сброс не подтверждён или отсутствует researchId"
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Хранилище счётчиков недоступно"
            )
    })
    public ResponseEntity<QuotaResetResponse> reset(@Valid @RequestBody QuotaResetRequest request) {
        log.info("POST /api/v1/quotas/reset - research: {}, confirmed: {}",
                request.researchId(), request.confirmReset());
        return ResponseEntity.ok(quotaResetService.reset(request.researchId(), request.confirmReset()));
    }
}
