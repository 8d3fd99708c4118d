package org.qubership.cloud.solrbackup.dto.solr;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolrResponse {
    private ResponseHeader responseHeader;
    private SolrError error;
    private Map<String, Object> exception;

    @JsonIgnore
    public boolean isFailed() {
        return (responseHeader != null && responseHeader.getStatus() != 0) || error != null || exception != null;
    }

    public String describeFailure() {
        if (error != null && error.getMsg() != null) {
            return error.getMsg();
        }
        if (exception != null && exception.get("msg") != null) {
            return String.valueOf(exception.get("msg"));
        }
        return "response status " + (responseHeader == null ? "unknown" : responseHeader.getStatus());
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseHeader {
        private int status;
        @JsonProperty("QTime")
        private Integer qTime;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SolrError {
        private String msg;
        private Integer code;
    }
}
