package com.migranet.core.review;

import com.migranet.core.model.ObjectKind;

import java.util.List;

/**
 * Post-conversion quality check. Findings are advisory; they never block deployment.
 */
public interface CodeReviewer {

    List<ReviewFinding> review(String sourceText, String targetText, ObjectKind kind);
}
