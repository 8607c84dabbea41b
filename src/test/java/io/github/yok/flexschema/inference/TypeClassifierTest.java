package io.github.yok.flexschema.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

class TypeClassifierTest {

    private final TypeClassifier classifier = new TypeClassifier();

    @Test
    void classifyType_正常ケース_代表的なサンプル_期待する型が返ること() {
        ClassificationContext ctx = ClassificationContext.DELIMITED;
        assertEquals(SemanticType.INTEGER, classifier.classifyType(List.of("1", "2", "3"), ctx));
        assertEquals(SemanticType.DECIMAL, classifier.classifyType(List.of("1.5", "2.25"), ctx));
        assertEquals(SemanticType.DATE,
                classifier.classifyType(List.of("2024-01-01", "2024-02-01"), ctx));
        assertEquals(SemanticType.BOOLEAN,
                classifier.classifyType(List.of("true", "false", "yes"), ctx));
        assertEquals(SemanticType.STRING, classifier.classifyType(List.of("hello", "world"), ctx));
    }

    @Test
    void classifyType_正常ケース_全コンテキストで同じ代表サンプル_同じ型が返ること() {
        for (ClassificationContext ctx : ClassificationContext.values()) {
            assertEquals(SemanticType.INTEGER, classifier.classifyType(List.of("1", "2", "3"), ctx));
            assertEquals(SemanticType.BOOLEAN,
                    classifier.classifyType(List.of("true", "false", "yes"), ctx));
        }
    }

    @Test
    void classifyType_正常ケース_空のサンプル_Stringが返ること() {
        assertEquals(SemanticType.STRING,
                classifier.classifyType(List.of(), ClassificationContext.DIRECTORY));
    }

    @Test
    void classifyType_正常ケース_通貨と桁区切りとパーセント_数値として扱われること() {
        assertEquals(SemanticType.INTEGER, classifier.classifyType(
                List.of("$1,000", "2,500", "30%"), ClassificationContext.DELIMITED));
        assertEquals(SemanticType.DECIMAL, classifier.classifyType(
                List.of("$1,000.50", "$2.75", "$3.10"), ClassificationContext.DELIMITED));
    }

    @Test
    void classifyType_正常ケース_閾値はコンテキストで異なる_4分の3の日付は区切り文字でのみDateになること() {
        List<String> samples = List.of("2024-01-01", "2024-02-01", "2024-03-01", "unknown");

        assertEquals(SemanticType.DATE,
                classifier.classifyType(samples, ClassificationContext.DELIMITED));
        assertEquals(SemanticType.STRING,
                classifier.classifyType(samples, ClassificationContext.SPREADSHEET));
    }

    @Test
    void classifyType_正常ケース_整数が9割以下_Decimalとなること() {
        // 9 of 10 numeric samples are integers: not more than 90%
        List<String> samples = List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "9.5");
        assertEquals(SemanticType.DECIMAL,
                classifier.classifyType(samples, ClassificationContext.DELIMITED));
    }

    @Test
    void classifyType_正常ケース_様々な日付形式_Dateとなること() {
        List<String> samples = List.of("01/15/2024", "2024/01/15", "2024-01-15T10:30:00",
                "2024-01-15 10:30", "20240115103000Z");
        assertEquals(SemanticType.DATE,
                classifier.classifyType(samples, ClassificationContext.DIRECTORY));
    }

    @Test
    void classify_正常ケース_String_最長サンプルが下限と上限で丸められること() {
        ClassificationResult shortest =
                classifier.classify(List.of("ab", "abc"), ClassificationContext.DELIMITED);
        assertEquals(SemanticType.STRING, shortest.getType());
        assertEquals(10, shortest.getRecommendedLength());

        ClassificationResult middle = classifier.classify(
                List.of("a sample value of 26 chars"), ClassificationContext.DELIMITED);
        assertEquals(26, middle.getRecommendedLength());

        ClassificationResult longest = classifier.classify(
                List.of(StringUtils.repeat('x', 5000)), ClassificationContext.DELIMITED);
        assertEquals(4000, longest.getRecommendedLength());
    }

    @Test
    void classify_正常ケース_数値型_コンテキストの固定長が返ること() {
        assertEquals(15, classifier.classify(List.of("1"), ClassificationContext.DELIMITED)
                .getRecommendedLength());
        assertEquals(10, classifier.classify(List.of("1"), ClassificationContext.SPREADSHEET)
                .getRecommendedLength());
        assertEquals(20, classifier.classify(List.of("1.5"), ClassificationContext.DIRECTORY)
                .getRecommendedLength());
        assertEquals(15, classifier.classify(List.of("1.5"), ClassificationContext.SPREADSHEET)
                .getRecommendedLength());
    }

    @Test
    void classify_正常ケース_日付と真偽値_長さがnullとなること() {
        assertNull(classifier.classify(List.of("2024-01-01"), ClassificationContext.DELIMITED)
                .getRecommendedLength());
        assertNull(classifier.classify(List.of("yes", "no"), ClassificationContext.DELIMITED)
                .getRecommendedLength());
    }

    @Test
    void recommendLength_正常ケース_サンプルなしのString_コンテキストの既定長が返ること() {
        assertEquals(255, classifier.recommendLength(SemanticType.STRING, List.of(),
                ClassificationContext.DELIMITED));
        assertEquals(50, classifier.recommendLength(SemanticType.STRING, List.of(),
                ClassificationContext.SPREADSHEET));
    }

    @Test
    void コンストラクタ_正常ケース_独自の長さ範囲_範囲で丸められること() {
        TypeClassifier custom = new TypeClassifier(20, 30);
        assertEquals(20, custom.classify(List.of("abc"), ClassificationContext.DELIMITED)
                .getRecommendedLength());
        assertEquals(30, custom.classify(List.of(StringUtils.repeat('y', 40)),
                ClassificationContext.DELIMITED).getRecommendedLength());
    }

    @Test
    void コンストラクタ_異常ケース_不正な長さ範囲_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new TypeClassifier(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new TypeClassifier(20, 10));
    }

    @Test
    void isNumeric_正常ケース_数値判定が行われること() {
        assertTrue(TypeClassifier.isNumeric("-12.5"));
        assertTrue(TypeClassifier.isNumeric("1e3"));
        assertTrue(TypeClassifier.isNumeric(" 42 "));
        assertFalse(TypeClassifier.isNumeric("12abc"));
        assertFalse(TypeClassifier.isNumeric("NaN"));
        assertFalse(TypeClassifier.isNumeric("Infinity"));
        assertFalse(TypeClassifier.isNumeric("1e999"));
        assertFalse(TypeClassifier.isNumeric(""));
    }

    @Test
    void isInteger_正常ケース_小数部の有無で判定されること() {
        assertTrue(TypeClassifier.isInteger("10"));
        assertTrue(TypeClassifier.isInteger("10.0"));
        assertFalse(TypeClassifier.isInteger("10.5"));
        assertFalse(TypeClassifier.isInteger("ten"));
    }

    @Test
    void isBooleanLike_正常ケース_大文字小文字を区別しないこと() {
        assertTrue(TypeClassifier.isBooleanLike("TRUE"));
        assertTrue(TypeClassifier.isBooleanLike("N"));
        assertTrue(TypeClassifier.isBooleanLike("0"));
        assertFalse(TypeClassifier.isBooleanLike("maybe"));
        assertFalse(TypeClassifier.isBooleanLike(null));
    }
}
