package io.github.yok.flexschema.ldif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class LineScannerTest {

    @Test
    void scan_正常ケース_改行で分割する_全行がインデックス付きで返ること() {
        LineScanner.ScannedLines lines = LineScanner.scan("dn: a=b\n\n# note\ncn: x");

        assertEquals(4, lines.size());
        assertEquals(new LdifLine(0, "dn: a=b", false), lines.get(0));
        assertEquals(new LdifLine(1, "", true), lines.get(1));
        assertEquals(new LdifLine(2, "# note", true), lines.get(2));
        assertEquals(new LdifLine(3, "cn: x", false), lines.get(3));
    }

    @Test
    void scan_正常ケース_反復を2回行う_同じ行列が先頭から返ること() {
        LineScanner.ScannedLines lines = LineScanner.scan("a: 1\nb: 2");

        List<String> first = new ArrayList<>();
        lines.forEach(l -> first.add(l.getText()));
        List<String> second = new ArrayList<>();
        lines.forEach(l -> second.add(l.getText()));

        assertEquals(List.of("a: 1", "b: 2"), first);
        assertEquals(first, second);
    }

    @Test
    void scan_正常ケース_nullを指定する_空行1件が返ること() {
        LineScanner.ScannedLines lines = LineScanner.scan(null);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).isSkippable());
    }

    @Test
    void scan_正常ケース_CRLFを含む_復帰文字が行末に残ること() {
        LineScanner.ScannedLines lines = LineScanner.scan("cn: x\r\nsn: y");
        assertEquals("cn: x\r", lines.get(0).getText());
    }

    @Test
    void iterator_異常ケース_終端を超えて取得する_NoSuchElementExceptionが送出されること() {
        Iterator<LdifLine> it = LineScanner.scan("x").iterator();
        it.next();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void startsWithContinuationMarker_正常ケース_先頭空白の有無で判定されること() {
        assertTrue(LineScanner.startsWithContinuationMarker(" folded"));
        assertFalse(LineScanner.startsWithContinuationMarker("\tfolded"));
        assertFalse(LineScanner.startsWithContinuationMarker("cn: x"));
        assertFalse(LineScanner.startsWithContinuationMarker(""));
        assertFalse(LineScanner.startsWithContinuationMarker(null));
    }

    @Test
    void isSkippable_正常ケース_空白行とコメント行のみスキップ対象となること() {
        assertTrue(LineScanner.isSkippable(""));
        assertTrue(LineScanner.isSkippable("   "));
        assertTrue(LineScanner.isSkippable("# comment"));
        assertFalse(LineScanner.isSkippable(" # folded text"));
        assertFalse(LineScanner.isSkippable("cn: x"));
    }

    @Test
    void isContinuation_正常ケース_LdifLineから判定できること() {
        assertTrue(new LdifLine(0, " part", false).isContinuation());
        assertFalse(new LdifLine(0, "part", false).isContinuation());
    }
}
