package spectralengine.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import spectralengine.service.SpectrumDiagnostics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Escribe informes de diagnóstico ({@link SpectrumDiagnostics}) en formato JSON.
 * <p>
 * Los espectros en sí no se serializan aquí: eso corresponde al colaborador de almacenamiento.
 */
@Slf4j
public class DiagnosticsJsonWriter {

    // Reutilizable y thread-safe una vez configurado.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public String toJson(SpectrumDiagnostics diagnostics) {
        try {
            return objectMapper.writeValueAsString(diagnostics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el diagnóstico de " + diagnostics.spectrum(), e);
        }
    }

    /**
     * Escribe el informe en {@code path}, creando los directorios padre. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public void writeToFile(SpectrumDiagnostics diagnostics, Path path) throws IOException {
        log.info("Escribiendo diagnóstico de {} en {}", diagnostics.spectrum(), path.toAbsolutePath());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), diagnostics);
        } catch (IOException e) {
            log.error("Error al escribir el diagnóstico JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
