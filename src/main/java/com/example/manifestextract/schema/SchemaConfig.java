package com.example.manifestextract.schema;

import java.util.List;

public record SchemaConfig(List<ManifestSchema> schemas) {
}
