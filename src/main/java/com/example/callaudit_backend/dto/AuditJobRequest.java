package com.example.callaudit_backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Submission payload: either a folder to scan or an explicit list of files.
 *
 * @param userId submitting operator
 * @param folder folder searched recursively for recordings
 * @param files explicit recordings, used when {@code folder} is absent
 */
public record AuditJobRequest(
        @NotBlank @Size(max = 128) String userId,
        String folder,
        List<String> files
) {
}
