package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.domain.model.FetchDelta;
import com.example.proposalwatch.domain.model.ProposalRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Renders a delta into subject, summary, HTML body and per-protocol fields.
 * The HTML body lists a bounded number of proposals per protocol.
 */
@Component
@RequiredArgsConstructor
public class ProposalDigestFactory {

    private static final DateTimeFormatter GENERATED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private static final int MAX_TITLE_CHARS = 80;

    private final NotificationProperties properties;
    private final Clock clock;

    public ProposalDigest create(FetchDelta delta) {
        var total = delta.totalCount();
        var protocols = delta.protocols().size();
        var now = clock.instant();
        var limit = properties.getMaxProposalsPerProtocol();

        var fields = new ArrayList<ProposalDigest.Field>();
        var html = new StringBuilder()
                .append("<html><body>")
                .append("<h2>").append(ProposalDigest.TITLE).append("</h2>")
                .append("<p>Found <strong>").append(total).append("</strong> new proposals across ")
                .append(protocols).append(" protocols:</p>");

        delta.asMap().forEach((protocol, records) -> {
            var name = protocol.toUpperCase(Locale.ROOT);
            fields.add(new ProposalDigest.Field(name, records.size() + " new proposals"));

            html.append("<h3>").append(escape(name)).append(" (").append(records.size()).append(" new)</h3><ul>");
            records.stream().limit(limit).forEach(record -> appendRecord(html, record));
            if (records.size() > limit) {
                html.append("<li><em>...and ").append(records.size() - limit).append(" more</em></li>");
            }
            html.append("</ul>");
        });

        html.append("<p><small>Generated at: ").append(GENERATED_AT.format(now)).append("</small></p>")
                .append("</body></html>");

        return ProposalDigest.builder()
                .subject(total + " " + ProposalDigest.TITLE)
                .summary("Found " + total + " new proposals across " + protocols + " protocols")
                .htmlBody(html.toString())
                .fields(fields)
                .totalCount(total)
                .generatedAt(now)
                .delta(delta)
                .build();
    }

    private static void appendRecord(StringBuilder html, ProposalRecord record) {
        var title = record.attribute("title", "No title");
        if (title.length() > MAX_TITLE_CHARS) {
            title = title.substring(0, MAX_TITLE_CHARS);
        }
        html.append("<li><strong>")
                .append(escape(record.attribute("type", "Proposal"))).append('-').append(record.getNumber())
                .append("</strong>: ").append(escape(title))
                .append("<br><small>Status: ").append(escape(record.attribute("status", "Unknown")))
                .append(" | Created: ").append(escape(record.attribute("created", "Unknown")))
                .append("</small></li>");
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text);
    }
}
