package com.migranet.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.repair.DeploymentAttempt;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable record of an object that could not be migrated.
 *
 * Written once, as one JSON document per object, when the object reaches
 * UNRESOLVED. Never mutated afterwards.
 */
@JsonPropertyOrder({"report_id", "object_name", "schema", "parent_package", "object_type", "created_at",
        "reason", "total_attempts", "attempts", "final_error", "final_attempted_text", "source_excerpt",
        "memory_context", "recommendations"})
public final class UnresolvedReport {

    static final int EXCERPT_CHARS = 2000;

    static final List<String> RECOMMENDATIONS = List.of(
            "Review the attempt history for a recurring error kind",
            "Adjust the target text by hand where the converter left source-dialect constructs",
            "Check referenced objects, constraints and identity columns on the target",
            "Verify the source object compiles and is compatible with the target dialect"
    );

    private final String                  reportId;
    private final String                  objectName;
    private final String                  schema;
    private final String                  parentPackage;
    private final ObjectKind              kind;
    private final Instant                 createdAt;
    private final String                  reason;
    private final List<DeploymentAttempt> attempts;
    private final String                  finalError;
    private final String                  finalAttemptedText;
    private final String                  sourceExcerpt;
    private final Map<String, Object>     memoryContext;

    private UnresolvedReport(Builder b) {
        this.reportId           = b.reportId;
        this.objectName         = b.objectName;
        this.schema             = b.schema;
        this.parentPackage      = b.parentPackage;
        this.kind               = b.kind;
        this.createdAt          = b.createdAt != null ? b.createdAt : Instant.now();
        this.reason             = b.reason;
        this.attempts           = b.attempts != null ? List.copyOf(b.attempts) : List.of();
        this.finalError         = b.finalError;
        this.finalAttemptedText = truncate(b.finalAttemptedText);
        this.sourceExcerpt      = truncate(b.sourceText);
        this.memoryContext      = b.memoryContext != null ? Map.copyOf(b.memoryContext) : Map.of();
    }

    private static String truncate(String text) {
        if (text == null) return "";
        return text.length() > EXCERPT_CHARS ? text.substring(0, EXCERPT_CHARS) : text;
    }

    @JsonProperty("report_id")            public String                  getReportId()           { return reportId; }
    @JsonProperty("object_name")          public String                  getObjectName()         { return objectName; }
    @JsonProperty("schema")               public String                  getSchema()             { return schema; }
    @JsonProperty("parent_package")       public String                  getParentPackage()      { return parentPackage; }
    @JsonProperty("object_type")          public ObjectKind              getKind()               { return kind; }
    @JsonProperty("created_at")           public Instant                 getCreatedAt()          { return createdAt; }
    @JsonProperty("reason")               public String                  getReason()             { return reason; }
    @JsonProperty("attempts")             public List<DeploymentAttempt> getAttempts()           { return attempts; }
    @JsonProperty("final_error")          public String                  getFinalError()         { return finalError; }
    @JsonProperty("final_attempted_text") public String                  getFinalAttemptedText() { return finalAttemptedText; }
    @JsonProperty("source_excerpt")       public String                  getSourceExcerpt()      { return sourceExcerpt; }
    @JsonProperty("memory_context")       public Map<String, Object>     getMemoryContext()      { return memoryContext; }
    @JsonProperty("recommendations")      public List<String>            getRecommendations()    { return RECOMMENDATIONS; }

    @JsonProperty("total_attempts")
    public int getTotalAttempts() {
        return attempts.size();
    }

    public static Builder builder(String reportId) {
        return new Builder(reportId);
    }

    public static final class Builder {
        private final String            reportId;
        private String                  objectName;
        private String                  schema;
        private String                  parentPackage;
        private ObjectKind              kind;
        private Instant                 createdAt;
        private String                  reason;
        private List<DeploymentAttempt> attempts;
        private String                  finalError;
        private String                  finalAttemptedText;
        private String                  sourceText;
        private Map<String, Object>     memoryContext;

        private Builder(String reportId) {
            this.reportId = reportId;
        }

        public Builder object(String name, String schema, String parentPackage, ObjectKind kind) {
            this.objectName    = name;
            this.schema        = schema;
            this.parentPackage = parentPackage;
            this.kind          = kind;
            return this;
        }

        public Builder createdAt(Instant v)                  { this.createdAt = v; return this; }
        public Builder reason(String v)                      { this.reason = v; return this; }
        public Builder attempts(List<DeploymentAttempt> v)   { this.attempts = v; return this; }
        public Builder finalError(String v)                  { this.finalError = v; return this; }
        public Builder finalAttemptedText(String v)          { this.finalAttemptedText = v; return this; }
        public Builder sourceText(String v)                  { this.sourceText = v; return this; }
        public Builder memoryContext(Map<String, Object> v)  { this.memoryContext = v; return this; }

        public UnresolvedReport build() {
            return new UnresolvedReport(this);
        }
    }
}
