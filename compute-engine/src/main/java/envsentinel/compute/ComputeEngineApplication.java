package envsentinel.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada principal del Compute Engine.
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, JPA, planificador).
 * 2. Cargar los modelos persistidos antes de aceptar tráfico (ver {@code ModelBootstrap}).
 */
@SpringBootApplication(scanBasePackages = "envsentinel")
public class ComputeEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(ComputeEngineApplication.class, args);
    }
}
