package com.example.manifestextract.web;

import com.example.manifestextract.config.ExtractionProperties;
import com.example.manifestextract.schema.ManifestSchema;
import com.example.manifestextract.schema.SchemaRegistry;
import com.example.manifestextract.service.ExtractionOptions;
import com.example.manifestextract.service.ExtractionResult;
import com.example.manifestextract.service.ManifestExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/manifest")
@RequiredArgsConstructor
public class ManifestExtractController {

    private final ManifestExtractionService extractionService;
    private final SchemaRegistry schemaRegistry;
    private final ExtractionProperties properties;

    @PostMapping("/extract")
    public ExtractionResult extract(@RequestParam("file") MultipartFile file,
                                    @RequestParam("kind") String kind,
                                    @RequestParam(value = "maxHeaderSearchRows", required = false)
                                    Integer maxHeaderSearchRows,
                                    @RequestParam(value = "threshold", required = false) Double threshold)
            throws IOException {
        checkUpload(file);
        ManifestSchema schema = schemaRegistry.get(kind);
        ExtractionOptions options = schema.options(properties.defaultOptions());
        if (maxHeaderSearchRows != null) {
            options = options.withMaxHeaderSearchRows(maxHeaderSearchRows);
        }
        if (threshold != null) {
            options = options.withThreshold(threshold);
        }
        log.info("Extracting '{}' ({} bytes) as {}", file.getOriginalFilename(), file.getSize(), kind);
        return extractionService.extract(file.getBytes(), file.getOriginalFilename(), schema.fields(), options);
    }

    @GetMapping("/schemas")
    public List<SchemaSummary> schemas() {
        return schemaRegistry.all().stream()
                .map(schema -> {
                    ExtractionOptions options = schema.options(properties.defaultOptions());
                    return new SchemaSummary(
                            schema.name(),
                            schema.description(),
                            options.minColumnMatchThreshold(),
                            options.maxRows(),
                            schema.fieldKeys());
                })
                .toList();
    }

    private void checkUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file must not be empty.");
        }
        if (file.getSize() > properties.maxFileSizeBytes()) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "File exceeds the maximum allowed size of " + properties.getMaxFileSizeMb() + "MB.");
        }
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename();
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!properties.getAllowedExtensions().contains(extension)) {
            throw new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                    "Only " + properties.getAllowedExtensions() + " files are accepted.");
        }
    }

    public record SchemaSummary(
            String name,
            String description,
            double threshold,
            int maxRows,
            List<String> fields
    ) {
    }
}
