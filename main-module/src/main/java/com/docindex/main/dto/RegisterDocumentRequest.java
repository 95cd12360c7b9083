package com.docindex.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for registering or updating a document")
public class RegisterDocumentRequest {

    @NotBlank
    @Schema(description = "Stable external key of the document", example = "2101.00001")
    private String key;

    @Schema(description = "Document title", example = "Attention Is All You Need")
    private String title;

    @Schema(description = "Author names", example = "[\"Ada Lovelace\"]")
    private List<String> authors;

    @NotBlank
    @Schema(description = "Abstract, the text that gets embedded")
    private String abstractText;

    @Schema(description = "Primary subject category", example = "cs.IR")
    private String primaryCategory;
}
