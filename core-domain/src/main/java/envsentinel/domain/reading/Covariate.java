package envsentinel.domain.reading;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Columnas que pueden alimentar a un modelo detrás de las tres columnas de calendario.
 * <p>
 * El orden de declaración ES el orden de columnas del vector de características;
 * cambiarlo invalida todos los modelos persistidos.
 */
@Getter
@RequiredArgsConstructor
public enum Covariate {

    PM25("pm25"),
    PM10("pm10"),
    CO2("co2"),
    NO2("no2"),
    PH("ph"),
    TURBIDITY("turbidity"),
    DISSOLVED_OXYGEN("dissolvedOxygen"),

    // Condiciones ambientales auxiliares (no tienen modelo propio)
    TEMPERATURE("temperature"),
    HUMIDITY("humidity");

    private final String code;

    /**
     * True si esta columna es la del parámetro objetivo (y por tanto no puede ser entrada de su modelo).
     */
    public boolean isTarget(Parameter parameter) {
        return name().equals(parameter.name());
    }
}
