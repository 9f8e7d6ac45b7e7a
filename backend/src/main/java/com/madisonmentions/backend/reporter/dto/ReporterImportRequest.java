package com.madisonmentions.backend.reporter.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReporterImportRequest {
    @NotNull
    @Size(max = 5000)
    private List<ReporterImportRow> reporters = new ArrayList<>();

    private boolean skipDuplicates = true;
}
