package com.portfoliosync.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Envelope of the {@code POST /margins/orders} response. Only the totals are read. */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class KiteOrderMarginResponse {

    private String status;

    private String message;

    private List<Entry> data;

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Entry {

        @JsonProperty("tradingsymbol")
        private String tradingSymbol;

        private String exchange;

        private BigDecimal total;
    }
}
