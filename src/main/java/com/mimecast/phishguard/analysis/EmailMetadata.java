package com.mimecast.phishguard.analysis;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Structured metadata taken from the message headers.
 */
public class EmailMetadata {
    private final String subject;

    @SerializedName("from_address")
    private final String fromAddress;

    @SerializedName("reply_to")
    private final String replyTo;

    @SerializedName("to_addresses")
    private final List<String> toAddresses;

    /**
     * Constructs a new EmailMetadata instance.
     *
     * @param subject     Subject or null.
     * @param fromAddress Sender or null.
     * @param replyTo     Reply-to or null.
     * @param toAddresses Recipients, null for none.
     */
    public EmailMetadata(String subject, String fromAddress, String replyTo, List<String> toAddresses) {
        this.subject = subject;
        this.fromAddress = fromAddress;
        this.replyTo = replyTo;
        this.toAddresses = toAddresses != null ? List.copyOf(toAddresses) : Collections.emptyList();
    }

    public String getSubject() {
        return subject;
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
}
