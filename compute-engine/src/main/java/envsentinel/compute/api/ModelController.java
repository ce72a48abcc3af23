package envsentinel.compute.api;

import envsentinel.compute.service.ModelStatusService;
import envsentinel.compute.service.ModelTrainingService;
import envsentinel.config.ApiRoutes;
import envsentinel.domain.dto.training.ModelStatusDTO;
import envsentinel.domain.dto.training.TrainingResponseDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(ApiRoutes.MODELS)
@RequiredArgsConstructor
@Tag(name = "Modelos", description = "Entrenamiento y estado de los modelos por parámetro")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ModelStatusService statusService;

    @PostMapping("/train")
    @Operation(summary = "Lanzar un ciclo de entrenamiento completo (bloquea hasta terminar)")
    public ResponseEntity<TrainingResponseDTO> train() {
        return ResponseEntity.ok(trainingService.runTrainingCycle().toResponse());
    }

    @GetMapping("/status")
    @Operation(summary = "Parámetros con modelo entrenado y resultado del último ciclo")
    public ResponseEntity<ModelStatusDTO> status() {
        return ResponseEntity.ok(statusService.status());
    }
}
