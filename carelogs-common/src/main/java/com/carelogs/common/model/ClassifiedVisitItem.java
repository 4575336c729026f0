package com.carelogs.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Classification result for a single visit record, keyed by (record index, batch id).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ClassifiedVisitItem implements OutputItem {

    /** Partition key: the record's index in the uploaded file, as a string. */
    private String id;

    private String batchId;

    private Category classification;

    /** Generation time, ISO-8601 local date-time. */
    private String timestamp;

    private String client;

    private String carePro;

    private String visitDate;

    private String note;

    public static ClassifiedVisitItem of(int recordIndex, String batchId, VisitRecord record,
            Category classification, String timestamp) {
        return ClassifiedVisitItem.builder()
                .id(String.valueOf(recordIndex))
                .batchId(batchId)
                .classification(classification)
                .timestamp(timestamp)
                .client(record.clientOr(""))
                .carePro(record.carePro())
                .visitDate(record.visitDate())
                .note(record.note())
                .build();
    }

    // ---------- DynamoDB mapping ----------

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() {
        return id;
    }

    @Override
    @DynamoDbSortKey
    @DynamoDbAttribute(BATCH_ID_ATTRIBUTE)
    public String getBatchId() {
        return batchId;
    }

    @DynamoDbAttribute("ai_classification")
    @DynamoDbConvertedBy(CategoryAttributeConverter.class)
    public Category getClassification() {
        return classification;
    }

    @DynamoDbAttribute("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @DynamoDbAttribute("client")
    public String getClient() {
        return client;
    }

    @DynamoDbAttribute("care_pro")
    public String getCarePro() {
        return carePro;
    }

    @DynamoDbAttribute("visit_date")
    public String getVisitDate() {
        return visitDate;
    }

    @DynamoDbAttribute("note")
    public String getNote() {
        return note;
    }
}
