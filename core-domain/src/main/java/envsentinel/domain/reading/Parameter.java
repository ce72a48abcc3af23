package envsentinel.domain.reading;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Magnitudes ambientales monitorizadas. Cada una tiene su propio trío de modelos
 * (regresor, escalador, detector de anomalías).
 * <p>
 * El orden de declaración es el orden en que se entrenan y se listan.
 */
@Getter
@RequiredArgsConstructor
public enum Parameter {

    // --- AIRE ---
    PM25("pm25", "µg/m³"),
    PM10("pm10", "µg/m³"),
    CO2("co2", "ppm"),
    NO2("no2", "ppb"),

    // --- AGUA ---
    PH("ph", "pH"),
    TURBIDITY("turbidity", "NTU"),
    DISSOLVED_OXYGEN("dissolvedOxygen", "mg/l");

    /**
     * Código en el cable y en el almacén de lecturas (ej: "dissolvedOxygen").
     */
    private final String code;
    private final String unit;

    private static final Map<String, Parameter> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(Parameter::getCode, Function.identity())));

    /**
     * Búsqueda exacta por código. Los códigos distinguen mayúsculas ("dissolvedOxygen").
     */
    public static Optional<Parameter> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(BY_CODE.get(code.trim()));
    }

    /**
     * Columna de covariable equivalente a este parámetro.
     */
    public Covariate asCovariate() {
        return Covariate.valueOf(name());
    }

    @Override
    public String toString() {
        return code;
    }
}
