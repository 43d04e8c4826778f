package com.svformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.svformatter.api.error.FormatterError;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {
    private final boolean successful;
    private final String originalCode;
    private final String formattedCode;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.originalCode = builder.originalCode;
        this.formattedCode = builder.formattedCode;
        this.errors = List.copyOf(builder.errors);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * Whether formatting succeeded and produced text different from the input.
     */
    public boolean isChanged() {
        return successful && formattedCode != null && !formattedCode.equals(originalCode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String originalCode;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder originalCode(String originalCode) {
            this.originalCode = originalCode;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
