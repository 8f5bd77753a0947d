package com.taxledger.importer;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw row of a broker history export, bound by header name.
 *
 * <p>Accepts the canonical English headers and the broker's native (Chinese) headers. Every
 * field is kept as text so that blank cells and unparseable values can be reported with the
 * row they came from.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CsvTransactionRow {

    @JsonProperty("account_id")
    @JsonAlias({"账户ID", "账户"})
    private String accountId;

    @JsonProperty("instrument_code")
    @JsonAlias({"股票代码", "代码"})
    private String instrumentCode;

    /** STOCK or OPTION; any other value is UNSUPPORTED. Blank = derived from the instrument code. */
    @JsonProperty("instrument_type")
    private String instrumentType;

    @JsonProperty("direction")
    @JsonAlias("买卖方向")
    private String direction;

    @JsonProperty("quantity")
    @JsonAlias("数量")
    private String quantity;

    @JsonProperty("price")
    @JsonAlias("成交价格")
    private String price;

    @JsonProperty("fee")
    @JsonAlias("合计手续费")
    private String fee;

    @JsonProperty("fee_currency")
    @JsonAlias("手续费币种")
    private String feeCurrency;

    @JsonProperty("currency")
    @JsonAlias("结算币种")
    private String currency;

    @JsonProperty("amount")
    @JsonAlias("金额")
    private String amount;

    @JsonProperty("executed_at")
    @JsonAlias("交易时间")
    private String executedAt;
}
