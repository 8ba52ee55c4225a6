package com.migranet.core.conversion;

import com.migranet.core.model.ObjectKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Payload for one FallbackTranslator call, as an ordered list of typed sections.
 *
 * Typed sections let RowDataGuard inspect every byte that leaves the process
 * before the translator sees it.
 */
public final class TranslationRequest {

    public enum SectionType {
        DDL,
        CODE,
        METADATA,
        PATTERN,
        ERROR,
        SEARCH,
        ROW_DATA
    }

    public static final class Section {
        private final SectionType type;
        private final String      title;
        private final String      content;

        public Section(SectionType type, String title, String content) {
            this.type    = Objects.requireNonNull(type, "type");
            this.title   = title != null ? title : type.name();
            this.content = content != null ? content : "";
        }

        public SectionType getType()    { return type; }
        public String      getTitle()   { return title; }
        public String      getContent() { return content; }
    }

    private final String        objectName;
    private final ObjectKind    kind;
    private final boolean       repair;
    private final List<Section> sections;

    private TranslationRequest(Builder b) {
        this.objectName = b.objectName;
        this.kind       = b.kind;
        this.repair     = b.repair;
        this.sections   = Collections.unmodifiableList(new ArrayList<>(b.sections));
    }

    public String        getObjectName() { return objectName; }
    public ObjectKind    getKind()       { return kind; }
    public List<Section> getSections()   { return sections; }

    /** True when patching failing target text rather than translating from scratch. */
    public boolean isRepair() { return repair; }

    public static Builder builder(String objectName, ObjectKind kind) {
        return new Builder(objectName, kind);
    }

    public static final class Builder {
        private final String        objectName;
        private final ObjectKind    kind;
        private final List<Section> sections = new ArrayList<>();
        private boolean             repair;

        private Builder(String objectName, ObjectKind kind) {
            this.objectName = Objects.requireNonNull(objectName, "objectName");
            this.kind       = Objects.requireNonNull(kind, "kind");
        }

        public Builder repair(boolean repair) {
            this.repair = repair;
            return this;
        }

        public Builder section(SectionType type, String title, String content) {
            if (content != null && !content.isBlank()) {
                sections.add(new Section(type, title, content));
            }
            return this;
        }

        public TranslationRequest build() {
            return new TranslationRequest(this);
        }
    }
}
