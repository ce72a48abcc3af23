package envsentinel.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String MODELS = CURRENT_VERSION + "/models";
    public static final String PREDICTIONS = CURRENT_VERSION + "/predictions";
    public static final String ANOMALIES = CURRENT_VERSION + "/anomalies";
    public static final String READINGS = CURRENT_VERSION + "/readings";
    public static final String HEALTH = CURRENT_VERSION + "/health";
}
