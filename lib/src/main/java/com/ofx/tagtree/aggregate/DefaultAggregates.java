package com.ofx.tagtree.aggregate;

import static com.ofx.tagtree.aggregate.ElementType.BOOLEAN;
import static com.ofx.tagtree.aggregate.ElementType.CURRENCY_CODE;
import static com.ofx.tagtree.aggregate.ElementType.DATETIME;
import static com.ofx.tagtree.aggregate.ElementType.DECIMAL;
import static com.ofx.tagtree.aggregate.ElementType.INTEGER;

/**
 * Built-in aggregate definitions for common OFX signon, banking and investment messages.
 *
 * <p>Each definition lists the elements left after flattening, so nested aggregates such as
 * {@code SECID} or {@code INVTRAN} are folded into their parents with {@code include}.
 */
public final class DefaultAggregates {

    private static final String[] SUBACCOUNTS = {"CASH", "MARGIN", "SHORT", "OTHER"};
    private static final String[] ASSET_CLASSES = {
        "DOMESTICBOND", "INTLBOND", "LARGESTOCK", "SMALLSTOCK", "INTLSTOCK", "MONEYMRKT", "OTHER"
    };

    public static final AggregateDefinition STATUS =
            AggregateDefinition.builder("STATUS")
                    .required("code", INTEGER)
                    .element(ElementSpec.oneOf("severity", true, "INFO", "WARN", "ERROR"))
                    .element(ElementSpec.text("message", 255, false))
                    .build();

    public static final AggregateDefinition FI =
            AggregateDefinition.builder("FI")
                    .element(ElementSpec.text("org", 32, true))
                    .element(ElementSpec.text("fid", 32, false))
                    .build();

    public static final AggregateDefinition SONRS =
            AggregateDefinition.builder("SONRS")
                    .include(STATUS)
                    .required("dtserver", DATETIME)
                    .element(ElementSpec.text("language", 3, true))
                    .optional("dtprofup", DATETIME)
                    .optional("dtacctup", DATETIME)
                    .includeOptional(FI)
                    .element(ElementSpec.text("sesscookie", 1000, false))
                    .element(ElementSpec.text("accesskey", 1000, false))
                    .build();

    public static final AggregateDefinition CURRENCY = currency("CURRENCY");

    public static final AggregateDefinition ORIGCURRENCY = currency("ORIGCURRENCY");

    public static final AggregateDefinition BANKACCTFROM = bankAccount("BANKACCTFROM");

    public static final AggregateDefinition BANKACCTTO = bankAccount("BANKACCTTO");

    public static final AggregateDefinition LEDGERBAL = balance("LEDGERBAL");

    public static final AggregateDefinition AVAILBAL = balance("AVAILBAL");

    public static final AggregateDefinition PAYEE =
            AggregateDefinition.builder("PAYEE")
                    .element(ElementSpec.text("name", 32, true))
                    .element(ElementSpec.text("addr1", 32, true))
                    .element(ElementSpec.text("addr2", 32, false))
                    .element(ElementSpec.text("addr3", 32, false))
                    .element(ElementSpec.text("city", 32, true))
                    .element(ElementSpec.text("state", 5, true))
                    .element(ElementSpec.text("postalcode", 11, true))
                    .element(ElementSpec.text("country", 3, false))
                    .element(ElementSpec.text("phone", 32, true))
                    .build();

    public static final AggregateDefinition STMTTRN =
            AggregateDefinition.builder("STMTTRN")
                    .currencyBearing()
                    .element(
                            ElementSpec.oneOf(
                                    "trntype", true, "CREDIT", "DEBIT", "INT", "DIV", "FEE", "SRVCHG",
                                    "DEP", "ATM", "POS", "XFER", "CHECK", "PAYMENT", "CASH", "DIRECTDEP",
                                    "DIRECTDEBIT", "REPEATPMT", "HOLD", "OTHER"))
                    .required("dtposted", DATETIME)
                    .optional("dtuser", DATETIME)
                    .optional("dtavail", DATETIME)
                    .required("trnamt", DECIMAL)
                    .element(ElementSpec.text("fitid", 255, true))
                    .element(ElementSpec.text("correctfitid", 255, false))
                    .element(ElementSpec.oneOf("correctaction", false, "REPLACE", "DELETE"))
                    .element(ElementSpec.text("srvrtid", 10, false))
                    .element(ElementSpec.text("checknum", 12, false))
                    .element(ElementSpec.text("refnum", 32, false))
                    .optional("sic", INTEGER)
                    .element(ElementSpec.text("payeeid", 12, false))
                    .element(ElementSpec.text("name", 32, false))
                    .includeOptional(PAYEE)
                    .includeOptional(BANKACCTTO)
                    .element(ElementSpec.text("memo", 255, false))
                    .includeOptional(CURRENCY)
                    .build();

    public static final AggregateDefinition INVTRAN =
            AggregateDefinition.builder("INVTRAN")
                    .element(ElementSpec.text("fitid", 255, true))
                    .element(ElementSpec.text("srvrtid", 10, false))
                    .required("dttrade", DATETIME)
                    .optional("dtsettle", DATETIME)
                    .element(ElementSpec.text("reversalfitid", 255, false))
                    .element(ElementSpec.text("memo", 255, false))
                    .build();

    public static final AggregateDefinition SECID =
            AggregateDefinition.builder("SECID")
                    .element(ElementSpec.text("uniqueid", 32, true))
                    .element(ElementSpec.text("uniqueidtype", 10, true))
                    .build();

    public static final AggregateDefinition INVBUY =
            AggregateDefinition.builder("INVBUY")
                    .currencyBearing()
                    .include(INVTRAN)
                    .include(SECID)
                    .required("units", DECIMAL)
                    .required("unitprice", DECIMAL)
                    .optional("markup", DECIMAL)
                    .optional("commission", DECIMAL)
                    .optional("taxes", DECIMAL)
                    .optional("fees", DECIMAL)
                    .optional("load", DECIMAL)
                    .required("total", DECIMAL)
                    .includeOptional(CURRENCY)
                    .element(ElementSpec.oneOf("subacctsec", true, SUBACCOUNTS))
                    .element(ElementSpec.oneOf("subacctfund", true, SUBACCOUNTS))
                    .element(ElementSpec.text("loanid", 32, false))
                    .optional("loanprincipal", DECIMAL)
                    .optional("loaninterest", DECIMAL)
                    .optional("dtpayroll", DATETIME)
                    .optional("prioryearcontrib", BOOLEAN)
                    .build();

    public static final AggregateDefinition BUYSTOCK =
            AggregateDefinition.builder("BUYSTOCK")
                    .currencyBearing()
                    .include(INVBUY)
                    .element(ElementSpec.oneOf("buytype", true, "BUY", "BUYTOCOVER"))
                    .build();

    public static final AggregateDefinition INVSELL =
            AggregateDefinition.builder("INVSELL")
                    .currencyBearing()
                    .include(INVTRAN)
                    .include(SECID)
                    .required("units", DECIMAL)
                    .required("unitprice", DECIMAL)
                    .optional("markdown", DECIMAL)
                    .optional("commission", DECIMAL)
                    .optional("taxes", DECIMAL)
                    .optional("fees", DECIMAL)
                    .optional("load", DECIMAL)
                    .optional("withholding", DECIMAL)
                    .optional("taxexempt", BOOLEAN)
                    .required("total", DECIMAL)
                    .optional("gain", DECIMAL)
                    .includeOptional(CURRENCY)
                    .element(ElementSpec.oneOf("subacctsec", true, SUBACCOUNTS))
                    .element(ElementSpec.oneOf("subacctfund", true, SUBACCOUNTS))
                    .element(ElementSpec.text("loanid", 32, false))
                    .optional("statewithholding", DECIMAL)
                    .optional("penalty", DECIMAL)
                    .build();

    public static final AggregateDefinition SELLSTOCK =
            AggregateDefinition.builder("SELLSTOCK")
                    .currencyBearing()
                    .include(INVSELL)
                    .element(ElementSpec.oneOf("selltype", true, "SELL", "SELLSHORT"))
                    .build();

    public static final AggregateDefinition INCOME =
            AggregateDefinition.builder("INCOME")
                    .currencyBearing()
                    .include(INVTRAN)
                    .include(SECID)
                    .element(ElementSpec.oneOf("incometype", true, "CGLONG", "CGSHORT", "DIV", "INTEREST", "MISC"))
                    .required("total", DECIMAL)
                    .element(ElementSpec.oneOf("subacctsec", true, SUBACCOUNTS))
                    .element(ElementSpec.oneOf("subacctfund", true, SUBACCOUNTS))
                    .optional("taxexempt", BOOLEAN)
                    .optional("withholding", DECIMAL)
                    .includeOptional(CURRENCY)
                    .build();

    public static final AggregateDefinition SECINFO =
            AggregateDefinition.builder("SECINFO")
                    .include(SECID)
                    .element(ElementSpec.text("secname", 120, true))
                    .element(ElementSpec.text("ticker", 32, false))
                    .element(ElementSpec.text("fiid", 32, false))
                    .element(ElementSpec.text("rating", 10, false))
                    .optional("unitprice", DECIMAL)
                    .optional("dtasof", DATETIME)
                    .includeOptional(CURRENCY)
                    .element(ElementSpec.text("memo", 255, false))
                    .build();

    public static final AggregateDefinition MFINFO =
            AggregateDefinition.builder("MFINFO")
                    .include(SECINFO)
                    .element(ElementSpec.oneOf("mftype", false, "OPENEND", "CLOSEEND", "OTHER"))
                    .optional("yield", DECIMAL)
                    .optional("dtyieldasof", DATETIME)
                    .listTag("MFASSETCLASS")
                    .listTag("FIMFASSETCLASS")
                    .build();

    public static final AggregateDefinition PORTION =
            AggregateDefinition.builder("PORTION")
                    .element(ElementSpec.oneOf("assetclass", true, ASSET_CLASSES))
                    .required("percent", DECIMAL)
                    .build();

    public static final AggregateDefinition FIPORTION =
            AggregateDefinition.builder("FIPORTION")
                    .element(ElementSpec.text("fiassetclass", 32, true))
                    .required("percent", DECIMAL)
                    .build();

    public static final AggregateDefinition STOCKINFO =
            AggregateDefinition.builder("STOCKINFO")
                    .include(SECINFO)
                    .element(ElementSpec.oneOf("stocktype", false, "COMMON", "PREFERRED", "CONVERTIBLE", "OTHER"))
                    .optional("yield", DECIMAL)
                    .optional("dtyieldasof", DATETIME)
                    .element(ElementSpec.oneOf("assetclass", false, ASSET_CLASSES))
                    .element(ElementSpec.text("fiassetclass", 32, false))
                    .build();

    private static final AggregateRegistry REGISTRY =
            AggregateRegistry.builder()
                    .register(STATUS)
                    .register(FI)
                    .register(SONRS)
                    .register(CURRENCY)
                    .register(ORIGCURRENCY)
                    .register(BANKACCTFROM)
                    .register(BANKACCTTO)
                    .register(LEDGERBAL)
                    .register(AVAILBAL)
                    .register(PAYEE)
                    .register(STMTTRN)
                    .register(INVTRAN)
                    .register(SECID)
                    .register(INVBUY)
                    .register(BUYSTOCK)
                    .register(INVSELL)
                    .register(SELLSTOCK)
                    .register(INCOME)
                    .register(SECINFO)
                    .register(MFINFO)
                    .register(PORTION)
                    .register(FIPORTION)
                    .register(STOCKINFO)
                    .build();

    private DefaultAggregates() {}

    public static AggregateRegistry registry() {
        return REGISTRY;
    }

    private static AggregateDefinition currency(String tag) {
        return AggregateDefinition.builder(tag)
                .required("currate", DECIMAL)
                .required("cursym", CURRENCY_CODE)
                .build();
    }

    private static AggregateDefinition bankAccount(String tag) {
        return AggregateDefinition.builder(tag)
                .element(ElementSpec.text("bankid", 9, true))
                .element(ElementSpec.text("branchid", 22, false))
                .element(ElementSpec.text("acctid", 22, true))
                .element(ElementSpec.oneOf("accttype", true, "CHECKING", "SAVINGS", "MONEYMRKT", "CREDITLINE", "CD"))
                .element(ElementSpec.text("acctkey", 22, false))
                .build();
    }

    private static AggregateDefinition balance(String tag) {
        return AggregateDefinition.builder(tag)
                .required("balamt", DECIMAL)
                .required("dtasof", DATETIME)
                .build();
    }
}
