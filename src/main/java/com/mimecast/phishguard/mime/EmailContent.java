package com.mimecast.phishguard.mime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Email artefacts handed to the analysis pipeline.
 *
 * <p>Built once per analysis call and discarded afterwards.
 * <br>The body is always present, possibly empty. Every other field is optional
 * <br>and returns null when absent, except recipients which defaults to an empty list.
 *
 * @see EmailDecoder
 */
public class EmailContent {
    private final String subject;
    private final String body;
    private final String rawHeaders;
    private final String fromAddress;
    private final String replyTo;
    private final List<String> toAddresses;
    private final String htmlBody;

    private EmailContent(Builder builder) {
        this.subject = builder.subject;
        this.body = builder.body != null ? builder.body : "";
        this.rawHeaders = builder.rawHeaders;
        this.fromAddress = builder.fromAddress;
        this.replyTo = builder.replyTo;
        this.toAddresses = Collections.unmodifiableList(new ArrayList<>(builder.toAddresses));
        this.htmlBody = builder.htmlBody;
    }

    /**
     * Creates a new builder.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public String getRawHeaders() {
        return rawHeaders;
    }

    public String getFromAddress() {
        return fromAddress;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public List<String> getToAddresses() {
        return toAddresses;
    }

    public String getHtmlBody() {
        return htmlBody;
    }

    @Override
    public String toString() {
        return "EmailContent{" +
                "subject='" + subject + '\'' +
                ", bodyLength=" + body.length() +
                ", fromAddress='" + fromAddress + '\'' +
                ", replyTo='" + replyTo + '\'' +
                ", toAddresses=" + toAddresses +
                ", hasHtmlBody=" + (htmlBody != null) +
                '}';
    }

    /**
     * EmailContent builder.
     */
    public static class Builder {
        private String subject;
        private String body = "";
        private String rawHeaders;
        private String fromAddress;
        private String replyTo;
        private final List<String> toAddresses = new ArrayList<>();
        private String htmlBody;

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder rawHeaders(String rawHeaders) {
            this.rawHeaders = rawHeaders;
            return this;
        }

        public Builder fromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder toAddresses(List<String> toAddresses) {
            this.toAddresses.clear();
            if (toAddresses != null) {
                this.toAddresses.addAll(toAddresses);
            }
            return this;
        }

        public Builder htmlBody(String htmlBody) {
            this.htmlBody = htmlBody;
            return this;
        }

        public EmailContent build() {
            return new EmailContent(this);
        }
    }
}
