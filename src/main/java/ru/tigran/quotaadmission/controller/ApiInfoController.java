package ru.tigran.quotaadmission.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Quota Admission Engine API",
                "Допуск участников исследований по демографическим квотам",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Квоты",
                            "Проверка участников, статистика и сброс счётчиков",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/quotas/validate", "Проверить участника и учесть его в квотах"),
                                    new ApiEndpoint("GET", "/api/v1/quotas/{researchId}/stats", "Заполнение квот исследования"),
                                    new ApiEndpoint("POST", "/api/v1/quotas/reset", "Обнулить счётчики исследования (confirmReset = true)")
                            )
                    ),
                    new EndpointGroup(
                            "Настройка квот",
                            "Правила квот исследования",
                            List.of(
                                    new ApiEndpoint("PUT", "/api/v1/quotas/{researchId}/config", "Создать или заменить конфигурацию квот"),
                                    new ApiEndpoint("GET", "/api/v1/quotas/{researchId}/config", "Получить конфигурацию квот")
                            )
                    ),
                    new EndpointGroup(
                            "Документация",
                            "Доступ к документации API",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI"),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате"),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов"),
                                    new ApiEndpoint("GET", "/actuator/health", "Состояние сервиса и хранилища счётчиков")
                            )
                    )
                )
        ));
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpointsResponse {
        private final String title;
        private final String description;
        private final String version;
        private final List<EndpointGroup> groups;
    }

    @Getter
    @RequiredArgsConstructor
    public static class EndpointGroup {
        private final String name;
        private final String description;
        private final List<ApiEndpoint> endpoints;
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpoint {
        private final String method;
        private final String path;
        private final String description;
    }
}
