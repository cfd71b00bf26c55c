package com.ofx.tagtree.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class OfxHeaderTest {

    private static final String V1_HEADER =
            String.join(
                    "\r\n",
                    "OFXHEADER:100",
                    "DATA:OFXSGML",
                    "VERSION:102",
                    "SECURITY:NONE",
                    "ENCODING:USASCII",
                    "CHARSET:1252",
                    "COMPRESSION:NONE",
                    "OLDFILEUID:NONE",
                    "NEWFILEUID:NONE",
                    "",
                    "<OFX></OFX>");

    @Test
    void parsesSgmlHeader() throws Exception {
        OfxHeader header = OfxHeader.parse(V1_HEADER);

        assertEquals(1, header.getMajorVersion());
        assertEquals("102", header.getVersion());
        assertEquals("NONE", header.getField("SECURITY"));
        assertEquals(9, header.getFields().size());
        assertEquals("<OFX></OFX>", header.getBody());
        assertEquals(Charset.forName("windows-1252"), header.getCharset());
        assertEquals(11, header.getBodyLine());
        assertEquals(1, header.getBodyColumn());
    }

    @Test
    void recordsWhereTheBodyStartsWithinTheFile() throws Exception {
        String instruction = "<?OFX OFXHEADER=\"200\" VERSION=\"220\"?>";
        OfxHeader sameLine = OfxHeader.parse("<?xml version=\"1.0\"?>\n" + instruction + "<OFX></OFX>");

        assertEquals(2, sameLine.getBodyLine());
        assertEquals(instruction.length() + 1, sameLine.getBodyColumn());

        OfxHeader leadingBlankLines = OfxHeader.parse("\r\n\r\nOFXHEADER:100\r\nDATA:OFXSGML\r\nVERSION:102\r\n<OFX></OFX>");
        assertEquals(6, leadingBlankLines.getBodyLine());
        assertEquals(1, leadingBlankLines.getBodyColumn());
    }

    @Test
    void sgmlHeaderWithUtf8EncodingDecodesAsUtf8() throws Exception {
        OfxHeader header =
                OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:160\nENCODING:UTF-8\nCHARSET:NONE\n<OFX></OFX>");

        assertEquals(StandardCharsets.UTF_8, header.getCharset());
    }

    @Test
    void sgmlHeaderWithoutCharsetDefaultsToLatin1() throws Exception {
        OfxHeader header = OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:151\n<OFX></OFX>");

        assertEquals(StandardCharsets.ISO_8859_1, header.getCharset());
    }

    @Test
    void parsesXmlHeader() throws Exception {
        OfxHeader header =
                OfxHeader.parse(
                        "\uFEFF<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                                + "<?OFX OFXHEADER=\"200\" VERSION=\"211\" SECURITY=\"NONE\"?>\n"
                                + "<OFX></OFX>");

        assertEquals(2, header.getMajorVersion());
        assertEquals("211", header.getVersion());
        assertEquals("NONE", header.getField("SECURITY"));
        assertEquals(StandardCharsets.UTF_8, header.getCharset());
        assertEquals("<OFX></OFX>", header.getBody().trim());
    }

    @Test
    void xmlDeclarationIsOptional() throws Exception {
        OfxHeader header = OfxHeader.parse("<?OFX OFXHEADER=\"200\" VERSION=\"200\"?><OFX></OFX>");

        assertEquals("200", header.getVersion());
        assertEquals(StandardCharsets.UTF_8, header.getCharset());
    }

    @Test
    void unknownXmlEncodingFallsBackToUtf8() throws Exception {
        OfxHeader header =
                OfxHeader.parse(
                        "<?xml version=\"1.0\" encoding=\"NOT-A-CHARSET\"?>"
                                + "<?OFX OFXHEADER=\"200\" VERSION=\"220\"?><OFX></OFX>");

        assertEquals(StandardCharsets.UTF_8, header.getCharset());
    }

    @Test
    void rejectsUnsupportedVersions() {
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:999\n<OFX></OFX>"));
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("<?OFX OFXHEADER=\"200\" VERSION=\"102\"?><OFX></OFX>"));
    }

    @Test
    void rejectsMalformedSgmlHeaders() {
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("OFXHEADER:100\nDATA:XML\nVERSION:102\n<OFX></OFX>"));
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:102\nVERSION:103\n<OFX></OFX>"));
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:102\nnot a field\n<OFX></OFX>"));
        assertThrows(OfxHeaderException.class, () -> OfxHeader.parse("OFXHEADER:100\nDATA:OFXSGML\nVERSION:102\n"));
    }

    @Test
    void rejectsDocumentsWithoutHeader() {
        OfxHeaderException ex = assertThrows(OfxHeaderException.class, () -> OfxHeader.parse("<OFX></OFX>"));
        assertTrue(ex.getMessage().contains("header"), ex.getMessage());
        assertThrows(
                OfxHeaderException.class,
                () -> OfxHeader.parse("<?xml version=\"1.0\"?><OFX></OFX>"));
    }
}
