package envsentinel.compute.api;

import envsentinel.compute.service.ModelStatusService;
import envsentinel.config.ApiRoutes;
import envsentinel.domain.dto.training.HealthResponseDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Salud", description = "Estado del servicio")
public class HealthController {

    private final ModelStatusService statusService;

    @GetMapping(ApiRoutes.HEALTH)
    @Operation(summary = "Comprobar que el servicio responde y si hay modelos cargados")
    public ResponseEntity<HealthResponseDTO> health() {
        return ResponseEntity.ok(statusService.health());
    }
}
