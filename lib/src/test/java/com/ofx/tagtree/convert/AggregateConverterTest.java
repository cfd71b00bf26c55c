package com.ofx.tagtree.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ofx.tagtree.aggregate.Aggregate;
import com.ofx.tagtree.aggregate.AggregateDefinition;
import com.ofx.tagtree.aggregate.AggregateRegistry;
import com.ofx.tagtree.aggregate.AggregateValidationException;
import com.ofx.tagtree.aggregate.DefaultAggregates;
import com.ofx.tagtree.aggregate.ElementType;
import com.ofx.tagtree.loader.OfxLoader;
import com.ofx.tagtree.loader.OfxParserOptions;
import com.ofx.tagtree.loader.OfxTreeBuilder;
import com.ofx.tagtree.loader.ast.TagNode;
import com.ofx.tagtree.testing.TestResources;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregateConverterTest {

    private static final String TRANSACTION_START =
            "<STMTTRN><TRNTYPE>DEBIT<DTPOSTED>20240105<TRNAMT>-42.17<FITID>20240105001";

    private final OfxTreeBuilder builder = new OfxTreeBuilder();
    private final AggregateConverter converter = new AggregateConverter(DefaultAggregates.registry());

    @Test
    void convertsTransactionWithoutForeignCurrency() throws Exception {
        ConvertedAggregate converted = converter.convert(builder.build(TRANSACTION_START + "</STMTTRN>"), true);

        Aggregate trn = converted.getAggregate();
        assertEquals("STMTTRN", converted.getTag());
        assertEquals("DEBIT", trn.getString("trntype"));
        assertEquals(0, new BigDecimal("-42.17").compareTo(trn.getDecimal("trnamt")));
        assertEquals(OffsetDateTime.of(2024, 1, 5, 0, 0, 0, 0, ZoneOffset.UTC), trn.getDateTime("dtposted"));
        assertFalse(trn.has(AggregateDefinition.CURTYPE));
        assertTrue(converted.getLists().isEmpty());
    }

    @Test
    void recordsCurrencyAggregate() throws Exception {
        TagNode node =
                builder.build(TRANSACTION_START + "<CURRENCY><CURRATE>1.25<CURSYM>CAD</CURRENCY></STMTTRN>");

        Aggregate trn = converter.convert(node, true).getAggregate();

        assertEquals("CURRENCY", trn.getString("curtype"));
        assertEquals(0, new BigDecimal("1.25").compareTo(trn.getDecimal("currate")));
        assertEquals("CAD", trn.getString("cursym"));
    }

    @Test
    void recordsOriginalCurrencyAggregate() throws Exception {
        TagNode node =
                builder.build(TRANSACTION_START + "<ORIGCURRENCY><CURRATE>1.0850<CURSYM>EUR</ORIGCURRENCY></STMTTRN>");

        Aggregate trn = converter.convert(node, true).getAggregate();

        assertEquals("ORIGCURRENCY", trn.getString("curtype"));
        assertEquals("EUR", trn.getString("cursym"));
    }

    @Test
    void currencyAndOriginalCurrencyTogetherAreAmbiguous() throws Exception {
        TagNode node =
                builder.build(
                        TRANSACTION_START
                                + "<CURRENCY><CURRATE>1.25</CURRENCY>"
                                + "<ORIGCURRENCY><CURSYM>EUR</ORIGCURRENCY></STMTTRN>");

        AmbiguousCurrencyException ex =
                assertThrows(AmbiguousCurrencyException.class, () -> converter.convert(node, true));
        assertEquals("STMTTRN", ex.getTag());
    }

    @Test
    void currencyTypeCollidingWithAnElementIsADuplicate() throws Exception {
        AggregateRegistry registry =
                AggregateRegistry.builder()
                        .register(
                                AggregateDefinition.builder("FXTRADE")
                                        .currencyBearing()
                                        .include(DefaultAggregates.CURRENCY)
                                        .build())
                        .build();
        TagNode node = builder.build("<FXTRADE><CURTYPE>X<CURRENCY><CURRATE>1<CURSYM>USD</CURRENCY></FXTRADE>");

        DuplicateKeyException ex =
                assertThrows(DuplicateKeyException.class, () -> new AggregateConverter(registry).convert(node, true));
        assertEquals(AggregateDefinition.CURTYPE, ex.getKey());
    }

    @Test
    void unregisteredTagIsRejected() throws Exception {
        TagNode node = builder.build("<INVACCTFROM><BROKERID>b<ACCTID>1</INVACCTFROM>");

        UnknownAggregateException ex =
                assertThrows(UnknownAggregateException.class, () -> converter.convert(node, true));
        assertEquals("INVACCTFROM", ex.getTag());
    }

    @Test
    void validationFailuresPropagate() throws Exception {
        TagNode node = builder.build("<STATUS><CODE>abc<SEVERITY>INFO</STATUS>");

        AggregateValidationException ex =
                assertThrows(AggregateValidationException.class, () -> converter.convert(node, false));
        assertEquals("code", ex.getElement());
    }

    @Test
    void strictnessIsPassedToTheType() throws Exception {
        String text = TRANSACTION_START + "<XFERID>77</STMTTRN>";

        assertThrows(AggregateValidationException.class, () -> converter.convert(builder.build(text), true));
        Aggregate lax = converter.convert(builder.build(text), false).getAggregate();
        assertFalse(lax.has("xferid"));
        assertEquals("20240105001", lax.getString("fitid"));
    }

    @Test
    void extractsMutualFundAssetClassLists() throws Exception {
        TagNode root =
                new OfxLoader(OfxParserOptions.defaults())
                        .load(TestResources.resolveResource("ofx/investment-v2.ofx"))
                        .getRoot();
        TagNode mfinfo = root.findDescendant("MFINFO");

        ConvertedAggregate converted = converter.convert(mfinfo, true);

        Aggregate fund = converted.getAggregate();
        assertEquals("Example Balanced Fund", fund.getString("secname"));
        assertEquals("555555555", fund.getString("uniqueid"));
        assertEquals("OPENEND", fund.getString("mftype"));

        List<ConvertedAggregate> portions = converted.getList("mfassetclass");
        assertEquals(2, portions.size());
        assertEquals("LARGESTOCK", portions.get(0).getAggregate().getString("assetclass"));
        assertEquals(0, new BigDecimal("40").compareTo(portions.get(1).getAggregate().getDecimal("percent")));

        List<ConvertedAggregate> fiPortions = converted.getList("fimfassetclass");
        assertEquals(1, fiPortions.size());
        assertEquals("Balanced", fiPortions.get(0).getAggregate().getString("fiassetclass"));

        assertNull(mfinfo.findChild("MFASSETCLASS"));
        assertNull(mfinfo.findChild("FIMFASSETCLASS"));
    }

    @Test
    void missingListContainerYieldsNoList() throws Exception {
        TagNode node =
                builder.build(
                        "<MFINFO><SECINFO><SECID><UNIQUEID>1<UNIQUEIDTYPE>CUSIP</SECID>"
                                + "<SECNAME>Fund</SECINFO></MFINFO>");

        ConvertedAggregate converted = converter.convert(node, true);

        assertTrue(converted.getLists().isEmpty());
        assertTrue(converted.getList("mfassetclass").isEmpty());
    }

    @Test
    void repeatedListContainerIsADuplicate() throws Exception {
        TagNode node =
                builder.build(
                        "<MFINFO><SECINFO><SECID><UNIQUEID>1<UNIQUEIDTYPE>CUSIP</SECID><SECNAME>Fund</SECINFO>"
                                + "<MFASSETCLASS><PORTION><ASSETCLASS>OTHER<PERCENT>100</PORTION></MFASSETCLASS>"
                                + "<MFASSETCLASS><PORTION><ASSETCLASS>OTHER<PERCENT>100</PORTION></MFASSETCLASS>"
                                + "</MFINFO>");

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, () -> converter.convert(node, true));
        assertEquals("mfassetclass", ex.getKey());
    }

    @Test
    void unregisteredListItemIsRejected() throws Exception {
        TagNode node =
                builder.build(
                        "<MFINFO><SECINFO><SECID><UNIQUEID>1<UNIQUEIDTYPE>CUSIP</SECID><SECNAME>Fund</SECINFO>"
                                + "<MFASSETCLASS><SLICE><PERCENT>100</SLICE></MFASSETCLASS></MFINFO>");

        UnknownAggregateException ex =
                assertThrows(UnknownAggregateException.class, () -> converter.convert(node, true));
        assertEquals("SLICE", ex.getTag());
    }

    @Test
    void failedConversionLeavesListContainersAttached() throws Exception {
        TagNode node =
                builder.build(
                        "<MFINFO><SECINFO><SECID><UNIQUEID>1<UNIQUEIDTYPE>CUSIP</SECID><SECNAME>Fund</SECINFO>"
                                + "<MFASSETCLASS><PORTION><ASSETCLASS>OTHER<PERCENT>100</PORTION></MFASSETCLASS>"
                                + "<FIMFASSETCLASS><SLICE><PERCENT>100</SLICE></FIMFASSETCLASS></MFINFO>");

        assertThrows(UnknownAggregateException.class, () -> converter.convert(node, true));

        assertNotNull(node.findChild("MFASSETCLASS"));
        assertNotNull(node.findChild("FIMFASSETCLASS"));
        assertEquals(1, node.findChild("MFASSETCLASS").getChildren().size());
    }

    @Test
    void validationFailureLeavesListContainersAttached() throws Exception {
        TagNode node =
                builder.build(
                        "<MFINFO><SECINFO><SECID><UNIQUEID>1<UNIQUEIDTYPE>CUSIP</SECID></SECINFO>"
                                + "<MFASSETCLASS><PORTION><ASSETCLASS>OTHER<PERCENT>100</PORTION></MFASSETCLASS>"
                                + "</MFINFO>");

        assertThrows(AggregateValidationException.class, () -> converter.convert(node, true));

        assertNotNull(node.findChild("MFASSETCLASS"));
    }

    @Test
    void repeatedElementIsADuplicateEvenForAnUnregisteredTag() throws Exception {
        TagNode node = builder.build("<A><B>1</B><B>2</B></A>");

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, () -> converter.convert(node, true));
        assertEquals("b", ex.getKey());
        assertEquals("A", ex.getTag());
    }

    @Test
    void repeatedElementIsADuplicateForARegisteredTag() throws Exception {
        AggregateRegistry registry =
                AggregateRegistry.builder()
                        .register(AggregateDefinition.builder("A").optional("b", ElementType.STRING).build())
                        .build();
        TagNode node = builder.build("<A><B>1</B><B>2</B></A>");

        DuplicateKeyException ex =
                assertThrows(DuplicateKeyException.class, () -> new AggregateConverter(registry).convert(node, true));
        assertEquals("b", ex.getKey());
    }

    @Test
    void convertsEveryTransactionOfTheCheckingStatement() throws Exception {
        TagNode root =
                new OfxLoader(OfxParserOptions.defaults())
                        .load(TestResources.resolveResource("ofx/checking-v1.ofx"))
                        .getRoot();

        List<TagNode> transactions = root.findAll("STMTTRN");
        Aggregate debit = converter.convert(transactions.get(0), true).getAggregate();
        Aggregate credit = converter.convert(transactions.get(1), true).getAggregate();

        assertEquals("POS PURCHASE", debit.getString("memo"));
        assertFalse(debit.has("curtype"));
        assertEquals("ORIGCURRENCY", credit.getString("curtype"));
        assertEquals(0, new BigDecimal("1500.00").compareTo(credit.getDecimal("trnamt")));

        ConvertedAggregate signon = converter.convert(root.findDescendant("SONRS"), true);
        assertEquals(Integer.valueOf(0), signon.getAggregate().getInteger("code"));
        assertEquals(OffsetDateTime.of(2024, 1, 31, 12, 0, 0, 0, ZoneOffset.ofHours(-5)),
                signon.getAggregate().getDateTime("dtserver"));
        assertEquals(List.of(new ExtensionElement("INTU.BID", "1234")), signon.getExtensions());
    }

    @Test
    void customTypesCanBeRegistered() throws Exception {
        AggregateRegistry registry =
                AggregateRegistry.builder()
                        .registerAll(DefaultAggregates.registry())
                        .register(
                                AggregateDefinition.builder("INVACCTFROM")
                                        .required("brokerid", ElementType.STRING)
                                        .required("acctid", ElementType.STRING)
                                        .build())
                        .build();

        Aggregate account =
                new AggregateConverter(registry)
                        .convert(builder.build("<INVACCTFROM><BROKERID>b<ACCTID>1</INVACCTFROM>"), true)
                        .getAggregate();

        assertEquals("b", account.getString("brokerid"));
    }
}
