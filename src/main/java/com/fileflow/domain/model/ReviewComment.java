package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Free-text remark left by a reviewer on a submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewComment {
    @JsonAlias("admin_id")
    private String actor;

    private String comment;
    private LocalDateTime timestamp;
}
