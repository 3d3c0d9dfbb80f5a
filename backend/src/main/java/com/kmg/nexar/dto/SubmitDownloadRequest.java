package com.kmg.nexar.dto;

import com.kmg.nexar.model.DownloadPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SubmitDownloadRequest(
        @NotBlank String sourceRef,
        DownloadPriority priority,
        @Size(max = 200) String title
) {
}
