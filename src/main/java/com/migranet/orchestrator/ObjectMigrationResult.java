package com.migranet.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.conversion.ConversionTool;
import com.migranet.core.model.MigrationStatus;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.repair.DeploymentAttempt;
import com.migranet.core.review.ReviewFinding;

import java.util.List;

/**
 * What happened to one object. Status is always terminal.
 */
public final class ObjectMigrationResult {

    private final String                  objectName;
    private final String                  qualifiedName;
    private final ObjectKind              kind;
    private final MigrationStatus         finalStatus;
    private final List<DeploymentAttempt> attempts;
    private final ConversionTool          conversionTool;
    private final List<ReviewFinding>     reviewFindings;
    private final String                  reportId;

    public ObjectMigrationResult(String objectName, String qualifiedName, ObjectKind kind,
                                 MigrationStatus finalStatus, List<DeploymentAttempt> attempts,
                                 ConversionTool conversionTool, List<ReviewFinding> reviewFindings,
                                 String reportId) {
        this.objectName     = objectName;
        this.qualifiedName  = qualifiedName != null ? qualifiedName : objectName;
        this.kind           = kind;
        this.finalStatus    = finalStatus;
        this.attempts       = attempts != null ? List.copyOf(attempts) : List.of();
        this.conversionTool = conversionTool;
        this.reviewFindings = reviewFindings != null ? List.copyOf(reviewFindings) : List.of();
        this.reportId       = reportId;
    }

    @JsonProperty("object_name")     public String                  getObjectName()     { return objectName; }
    @JsonProperty("qualified_name")  public String                  getQualifiedName()  { return qualifiedName; }
    @JsonProperty("kind")            public ObjectKind              getKind()           { return kind; }
    @JsonProperty("final_status")    public MigrationStatus         getFinalStatus()    { return finalStatus; }
    @JsonProperty("attempts")        public List<DeploymentAttempt> getAttempts()       { return attempts; }
    @JsonProperty("conversion_tool") public ConversionTool          getConversionTool() { return conversionTool; }
    @JsonProperty("review_findings") public List<ReviewFinding>     getReviewFindings() { return reviewFindings; }

    /** Null unless the object is UNRESOLVED and its report was written. */
    @JsonProperty("report_id")       public String                  getReportId()       { return reportId; }

    /** Unique within a batch: "Table HR.EMPLOYEES", "PackageMember HR.PKG_A.INIT". */
    public String getSummaryKey() {
        return kind.getLabel() + " " + qualifiedName;
    }

    public boolean isDeployed() {
        return finalStatus == MigrationStatus.DEPLOYED;
    }

    @Override
    public String toString() {
        return getSummaryKey() + " → " + finalStatus + " (" + attempts.size() + " attempt(s))";
    }
}
