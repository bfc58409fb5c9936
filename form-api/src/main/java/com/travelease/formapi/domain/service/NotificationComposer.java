package com.travelease.formapi.domain.service;

import com.travelease.formapi.domain.model.EmailContent;
import com.travelease.formapi.domain.model.Submission;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Builds the customer and owner notification emails. Both list name, email, phone, inquiry type
 * and message in that order, together with the submission id.
 */
@Service
public class NotificationComposer {

    public EmailContent customerEmail(Submission submission) {
        String subject = "Thank you for your submission, " + submission.name();
        String text = """
                Hello %s,

                Thank you for contacting TravelEase. We received your submission (ID: %s).
                Here are the details:
                - Name: %s
                - Email: %s
                - Phone: %s
                - Inquiry Type: %s
                - Message: %s
                """.formatted(
                submission.name(),
                submission.submissionId(),
                submission.name(),
                submission.email(),
                submission.phone(),
                submission.inquiryType(),
                submission.message());
        return new EmailContent(subject, text, html("TravelEase Submission Received", submission));
    }

    public EmailContent ownerEmail(Submission submission) {
        String subject = "New TravelEase submission from " + submission.name();
        String text = """
                A new travel form submission has been received.

                Submission ID: %s
                Name: %s
                Email: %s
                Phone: %s
                Inquiry Type: %s
                Message: %s
                """.formatted(
                submission.submissionId(),
                submission.name(),
                submission.email(),
                submission.phone(),
                submission.inquiryType(),
                submission.message());
        return new EmailContent(subject, text, html("New TravelEase Form Submission", submission));
    }

    private String html(String heading, Submission submission) {
        return """
                <html>
                  <body>
                    <h1>%s</h1>
                    <p><strong>Submission ID:</strong> %s</p>
                    <ul>
                      <li><strong>Name:</strong> %s</li>
                      <li><strong>Email:</strong> %s</li>
                      <li><strong>Phone:</strong> %s</li>
                      <li><strong>Inquiry Type:</strong> %s</li>
                      <li><strong>Message:</strong> %s</li>
                    </ul>
                  </body>
                </html>
                """.formatted(
                heading,
                submission.submissionId(),
                escape(submission.name()),
                escape(submission.email()),
                escape(submission.phone()),
                escape(submission.inquiryType()),
                escape(submission.message()));
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value);
    }
}
