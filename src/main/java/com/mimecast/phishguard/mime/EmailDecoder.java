package com.mimecast.phishguard.mime;

import jakarta.mail.BodyPart;
import jakarta.mail.Header;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimePartDataSource;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * RFC 822 / MIME message decoder.
 * <p>
 * Turns raw message bytes into {@link EmailContent}:
 * <ul>
 *     <li>Body is the first {@code text/plain} part found depth first, or the first sub-part
 *     when there is none. Single part messages use their own payload.</li>
 *     <li>HTML body is the first {@code text/html} part found depth first, multipart only.</li>
 *     <li>Subject, From, Reply-To and every To header are unfolded and RFC 2047 decoded.</li>
 *     <li>Raw headers are flattened to {@code Key: Value} lines in original order.</li>
 * </ul>
 * Text is decoded with the declared charset, UTF-8 when missing or unknown, replacing invalid sequences.
 * <p>
 * Decoding is best effort. Input that does not start with a header block is read as body text.
 * A multipart whose boundary never appears falls back to its raw payload.
 * Nested parts that cannot be read are logged and skipped.
 * Only input with no content at all raises {@link MalformedMessageException}.
 * <p>
 * Instances hold no per message state and may be shared between threads.
 */
public class EmailDecoder {
    private static final Logger log = LogManager.getLogger(EmailDecoder.class);

    private static final String TEXT_PLAIN = "text/plain";
    private static final String TEXT_HTML = "text/html";

    /**
     * Header field line, printable ASCII name without spaces followed by a colon.
     */
    private static final Pattern HEADER_LINE = Pattern.compile("^[\\x21-\\x39\\x3B-\\x7E]+:");

    /**
     * Mail session used only as a parsing context.
     */
    private final Session session;

    /**
     * Constructs a new EmailDecoder instance.
     */
    public EmailDecoder() {
        Properties props = new Properties();
        props.setProperty("mail.mime.ignoreunknownencoding", "true");
        props.setProperty("mail.mime.multipart.allowempty", "false");
        this.session = Session.getInstance(props);
    }

    /**
     * Decodes raw message bytes.
     *
     * @param bytes RFC 822 message bytes.
     * @return EmailContent instance.
     * @throws MalformedMessageException If the bytes are empty or blank.
     */
    public EmailContent decode(byte[] bytes) throws MalformedMessageException {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedMessageException("Message is empty");
        }
        if (StringUtils.isBlank(new String(bytes, StandardCharsets.ISO_8859_1))) {
            throw new MalformedMessageException("Message has no content");
        }

        MimeMessage message;
        try {
            message = new MimeMessage(session, new ByteArrayInputStream(separateHeaders(bytes)));
        } catch (MessagingException e) {
            throw new MalformedMessageException("Unable to parse message: " + e.getMessage(), e);
        }

        try {
            EmailContent.Builder builder = EmailContent.builder()
                    .subject(decodeHeader(message.getHeader("Subject", null)))
                    .fromAddress(decodeHeader(message.getHeader("From", null)))
                    .replyTo(decodeHeader(message.getHeader("Reply-To", null)))
                    .toAddresses(getAll(message, "To"))
                    .rawHeaders(serializeHeaders(message));

            if (message.isMimeType("multipart/*")) {
                MimeMultipart multipart = parseMultipart(message);
                if (multipart != null) {
                    builder.body(extractBody(multipart))
                            .htmlBody(findText(multipart, TEXT_HTML));
                } else {
                    builder.body(readRaw(message));
                }
            } else {
                builder.body(extractSinglePart(message));
            }

            EmailContent content = builder.build();
            log.debug("Decoded message: {}", content);
            return content;

        } catch (MessagingException | IOException e) {
            throw new MalformedMessageException("Unable to parse message structure: " + e.getMessage(), e);
        }
    }

    /**
     * Inserts the blank line that ends the header block when the input lacks one.
     * <p>
     * The header block ends at the first line that is neither a header field nor a continuation.
     * When that is the very first line the whole input becomes the body.
     *
     * @param bytes Raw message bytes.
     * @return Bytes with a header separator, the input itself when already well formed.
     */
    static byte[] separateHeaders(byte[] bytes) {
        int start = 0;
        while (start < bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') {
                end++;
            }

            String line = StringUtils.removeEnd(new String(bytes, start, end - start, StandardCharsets.ISO_8859_1), "\r");
            if (line.isEmpty()) {
                return bytes;
            }

            boolean continuation = start > 0 && (line.charAt(0) == ' ' || line.charAt(0) == '\t');
            boolean mbox = start == 0 && line.startsWith("From ");
            if (!continuation && !mbox && !HEADER_LINE.matcher(line).find()) {
                log.debug("Header block ends without separator at offset {}", start);
                byte[] repaired = new byte[bytes.length + 2];
                System.arraycopy(bytes, 0, repaired, 0, start);
                repaired[start] = '\r';
                repaired[start + 1] = '\n';
                System.arraycopy(bytes, start, repaired, start + 2, bytes.length - start);
                return repaired;
            }

            start = end + 1;
        }
        return bytes;
    }

    /**
     * Parses the top level multipart.
     *
     * @param message Message declared as multipart.
     * @return MimeMultipart instance, or null when the declared structure is absent.
     */
    private MimeMultipart parseMultipart(MimeMessage message) {
        try {
            MimeMultipart multipart = new MimeMultipart(new MimePartDataSource(message));
            int count = multipart.getCount();
            log.debug("Decoding multipart message with {} top level parts", count);
            return multipart;
        } catch (MessagingException e) {
            log.warn("Unable to parse multipart structure, using raw content: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Reads the payload of a message as text, ignoring any MIME structure.
     *
     * @param message Message.
     * @return Payload text.
     * @throws MessagingException Unable to access the message content.
     * @throws IOException        Unable to read the message content.
     */
    private String readRaw(MimeMessage message) throws MessagingException, IOException {
        try (InputStream raw = message.getRawInputStream()) {
            return new String(raw.readAllBytes(), charsetOf(message));
        }
    }

    /**
     * Extracts the body of a multipart message.
     *
     * @param multipart Top level multipart.
     * @return Body text, empty if nothing readable.
     * @throws MessagingException Unable to read the top level structure.
     */
    private String extractBody(MimeMultipart multipart) throws MessagingException {
        String plain = findText(multipart, TEXT_PLAIN);
        if (plain != null) {
            return plain;
        }

        // Fallback to first part.
        if (multipart.getCount() > 0) {
            BodyPart first = multipart.getBodyPart(0);
            try {
                if (first.isMimeType("multipart/*")) {
                    return "";
                }
                String text = decodeText(first);
                if (text != null) {
                    return text;
                }
            } catch (IOException | MessagingException e) {
                log.warn("Unable to decode first part: {}", e.getMessage());
            }
        }

        return "";
    }

    /**
     * Extracts the body of a single part message.
     * <p>Falls back to the raw content when the payload cannot be decoded.
     *
     * @param message MimeMessage instance.
     * @return Body text.
     * @throws MessagingException Unable to read the message.
     * @throws IOException        Unable to read the raw content.
     */
    private String extractSinglePart(MimeMessage message) throws MessagingException, IOException {
        try {
            String text = decodeText(message);
            if (text != null) {
                return text;
            }
        } catch (IOException e) {
            log.warn("Unable to decode payload, using raw content: {}", e.getMessage());
        }

        try (InputStream raw = message.getRawInputStream()) {
            return new String(raw.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Depth first search for the first part of given type with a non empty payload.
     *
     * @param multipart Multipart to search.
     * @param mimeType  MIME type to look for.
     * @return Decoded text or null.
     * @throws MessagingException Unable to read the given multipart.
     */
    private String findText(MimeMultipart multipart, String mimeType) throws MessagingException {
        for (int i = 0; i < multipart.getCount(); i++) {
            BodyPart part = multipart.getBodyPart(i);
            try {
                String text = findText(part, mimeType);
                if (text != null) {
                    return text;
                }
            } catch (IOException | MessagingException e) {
                log.warn("Skipping unreadable part {} while looking for {}: {}", i, mimeType, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Depth first search within a single part.
     * <p>Descends into nested multiparts and embedded {@code message/rfc822} parts.
     *
     * @param part     Part to search.
     * @param mimeType MIME type to look for.
     * @return Decoded text or null.
     * @throws MessagingException Unable to read the part structure.
     * @throws IOException        Unable to read the part content.
     */
    private String findText(Part part, String mimeType) throws MessagingException, IOException {
        if (part.isMimeType(mimeType)) {
            return decodeText(part);
        }

        if (part.isMimeType("multipart/*") && part instanceof MimePart) {
            return findText(new MimeMultipart(new MimePartDataSource((MimePart) part)), mimeType);
        }

        if (part.isMimeType("message/rfc822")) {
            try (InputStream is = part.getInputStream()) {
                MimeMessage embedded = new MimeMessage(session, is);
                if (embedded.isMimeType("multipart/*")) {
                    return findText(new MimeMultipart(new MimePartDataSource(embedded)), mimeType);
                }
                return findText(embedded, mimeType);
            }
        }

        return null;
    }

    /**
     * Decodes part payload to text.
     *
     * @param part Part instance.
     * @return Text or null if the payload is empty.
     * @throws MessagingException Unable to read the part.
     * @throws IOException        Unable to read the content.
     */
    private String decodeText(Part part) throws MessagingException, IOException {
        byte[] payload;
        try (InputStream is = part.getInputStream()) {
            payload = is.readAllBytes();
        }

        if (payload.length == 0) {
            return null;
        }

        return new String(payload, charsetOf(part));
    }

    /**
     * Resolves the declared charset of a part.
     *
     * @param part Part instance.
     * @return Charset, UTF-8 when missing or unknown.
     */
    private Charset charsetOf(Part part) {
        String charset = null;
        try {
            String contentType = part.getContentType();
            if (contentType != null) {
                charset = new ContentType(contentType).getParameter("charset");
            }
        } catch (ParseException e) {
            log.debug("Unparsable content type: {}", e.getMessage());
        } catch (MessagingException e) {
            log.debug("Unable to read content type: {}", e.getMessage());
        }

        if (charset == null || charset.isBlank()) {
            return StandardCharsets.UTF_8;
        }

        try {
            return Charset.forName(MimeUtility.javaCharset(charset.trim()));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Unknown charset {}, falling back to UTF-8", charset);
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * Unfolds and decodes RFC 2047 encoded header value.
     *
     * @param value Raw header value.
     * @return Decoded value or null.
     */
    private String decodeHeader(String value) {
        if (value == null) {
            return null;
        }

        String unfolded = MimeUtility.unfold(value);
        try {
            return MimeUtility.decodeText(unfolded);
        } catch (UnsupportedEncodingException e) {
            log.debug("Unable to decode header value: {}", e.getMessage());
            return unfolded;
        }
    }

    /**
     * Gets every value of a header.
     *
     * @param message MimeMessage instance.
     * @param name    Header name.
     * @return List of values, empty if none.
     * @throws MessagingException Unable to read headers.
     */
    private List<String> getAll(MimeMessage message, String name) throws MessagingException {
        List<String> values = new ArrayList<>();
        String[] headers = message.getHeader(name);
        if (headers != null) {
            Arrays.stream(headers)
                    .map(this::decodeHeader)
                    .forEach(values::add);
        }
        return values;
    }

    /**
     * Flattens all headers into {@code Key: Value} lines.
     *
     * @param message MimeMessage instance.
     * @return Header dump.
     * @throws MessagingException Unable to read headers.
     */
    private String serializeHeaders(MimeMessage message) throws MessagingException {
        List<String> lines = new ArrayList<>();
        Enumeration<Header> headers = message.getAllHeaders();
        while (headers.hasMoreElements()) {
            Header header = headers.nextElement();
            lines.add(header.getName() + ": " + header.getValue());
        }
        return String.join("\n", lines);
    }
}
