package envsentinel.compute.api;

import envsentinel.compute.service.PredictionService;
import envsentinel.config.ApiRoutes;
import envsentinel.domain.dto.prediction.AnomalyResponseDTO;
import envsentinel.domain.dto.prediction.ForecastResponseDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Predicción", description = "Predicciones por sensor y chequeo de anomalías en tiempo real")
public class PredictionController {

    private final PredictionService predictionService;

    @GetMapping(ApiRoutes.PREDICTIONS + "/{sensorId}")
    @Operation(summary = "Predecir los parámetros de un sensor N horas por delante")
    public ResponseEntity<ForecastResponseDTO> forecast(
            @PathVariable("sensorId") String sensorId,
            @RequestParam(name = "hours_ahead", defaultValue = "1") int hoursAhead
    ) {
        return ResponseEntity.ok(predictionService.forecast(sensorId, hoursAhead));
    }

    @PostMapping(ApiRoutes.ANOMALIES)
    @Operation(summary = "Evaluar valores sueltos (parámetro -> valor) contra los detectores")
    public ResponseEntity<AnomalyResponseDTO> checkAnomalies(@RequestBody Map<String, Object> sensorData) {
        return ResponseEntity.ok(predictionService.checkAnomalies(sensorData));
    }
}
