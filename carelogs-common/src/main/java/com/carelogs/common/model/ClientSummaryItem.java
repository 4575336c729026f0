package com.carelogs.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Rolling summary of one client's visits within a batch, keyed by (client, batch id).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ClientSummaryItem implements OutputItem {

    private String client;

    private String batchId;

    /** Lexical max of visit_date over all of the client's records. */
    private String latestVisitDate;

    /** All of the client's records, including those with empty notes. */
    private Integer visitCount;

    private String summary;

    private String timestamp;

    // ---------- DynamoDB mapping ----------

    @DynamoDbPartitionKey
    @DynamoDbAttribute("client")
    public String getClient() {
        return client;
    }

    @Override
    @DynamoDbSortKey
    @DynamoDbAttribute(BATCH_ID_ATTRIBUTE)
    public String getBatchId() {
        return batchId;
    }

    @DynamoDbAttribute("latest_visit_date")
    public String getLatestVisitDate() {
        return latestVisitDate;
    }

    @DynamoDbAttribute("visit_count")
    public Integer getVisitCount() {
        return visitCount;
    }

    @DynamoDbAttribute("summary")
    public String getSummary() {
        return summary;
    }

    @DynamoDbAttribute("timestamp")
    public String getTimestamp() {
        return timestamp;
    }
}
