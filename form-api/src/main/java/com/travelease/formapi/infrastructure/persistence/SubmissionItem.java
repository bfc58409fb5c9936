package com.travelease.formapi.infrastructure.persistence;

import com.travelease.formapi.domain.model.Submission;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * DynamoDB item for a submission. Attribute names match the JSON sent to the queue and topic.
 */
@DynamoDbBean
public class SubmissionItem {
    private String submissionId;
    private String name;
    private String email;
    private String phone;
    private String inquiryType;
    private String message;
    private String createdAt;

    // Default constructor required by DynamoDb Enhanced Client
    public SubmissionItem() {
    }

    public SubmissionItem(String submissionId, String name, String email, String phone,
                          String inquiryType, String message, String createdAt) {
        this.submissionId = submissionId;
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.inquiryType = inquiryType;
        this.message = message;
        this.createdAt = createdAt;
    }

    public static SubmissionItem from(Submission submission) {
        return new SubmissionItem(
                submission.submissionId().toString(),
                submission.name(),
                submission.email(),
                submission.phone(),
                submission.inquiryType(),
                submission.message(),
                submission.createdAt().toString());
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("submission_id")
    public String getSubmissionId() {
        return submissionId;
    }

    public void setSubmissionId(String submissionId) {
        this.submissionId = submissionId;
    }

    @DynamoDbAttribute("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @DynamoDbAttribute("email")
    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    @DynamoDbAttribute("phone")
    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    @DynamoDbAttribute("inquiry_type")
    public String getInquiryType() {
        return inquiryType;
    }

    public void setInquiryType(String inquiryType) {
        this.inquiryType = inquiryType;
    }

    @DynamoDbAttribute("message")
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @DynamoDbAttribute("created_at")
    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }
}
