package envsentinel.compute.api;

import envsentinel.compute.service.ReadingService;
import envsentinel.config.ApiRoutes;
import envsentinel.domain.dto.reading.ReadingCreationDTO;
import envsentinel.domain.reading.Reading;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(ApiRoutes.READINGS)
@RequiredArgsConstructor
@Tag(name = "Lecturas", description = "Ingesta de lecturas de sensores")
public class ReadingController {

    private final ReadingService readingService;

    @PostMapping
    @Operation(summary = "Registrar una lectura multivariable")
    public ResponseEntity<Reading> ingest(@RequestBody ReadingCreationDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(readingService.ingest(request));
    }
}
