package com.flamingo.ai.docsearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting an already extracted document text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestDocumentRequest {

  @Size(max = 255, message = "File name must be at most 255 characters")
  private String fileName;

  /** Source format tag, e.g. txt, md, pdf. Defaults to txt. */
  @Pattern(regexp = "[A-Za-z0-9]{1,16}", message = "Format must be a short alphanumeric tag")
  private String format;

  @NotBlank(message = "Text is required")
  private String text;

  private Map<String, String> metadata;
}
