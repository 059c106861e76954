package warehouse.bridge.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @Test
    void testLeadingKeywords() {
        assertEquals(StatementCategory.SELECT, classifier.classify("SELECT 1"));
        assertEquals(StatementCategory.SELECT, classifier.classify("select * from t"));
        assertEquals(StatementCategory.DESCRIBE, classifier.classify("DESC TABLE t"));
        assertEquals(StatementCategory.INSERT, classifier.classify("INSERT INTO t VALUES (1)"));
        assertEquals(StatementCategory.UPDATE, classifier.classify("update t set a = 1"));
        assertEquals(StatementCategory.DELETE, classifier.classify("DELETE FROM t"));
        assertEquals(StatementCategory.MERGE, classifier.classify("MERGE INTO t USING s ON t.id = s.id"));
        assertEquals(StatementCategory.TRUNCATE_TABLE, classifier.classify("TRUNCATE TABLE t"));
        assertEquals(StatementCategory.CREATE, classifier.classify("CREATE TABLE t (a INT)"));
        assertEquals(StatementCategory.ALTER, classifier.classify("ALTER TABLE t ADD COLUMN b INT"));
        assertEquals(StatementCategory.DROP, classifier.classify("DROP TABLE X"));
        assertEquals(StatementCategory.COMMIT, classifier.classify("COMMIT"));
        assertEquals(StatementCategory.ROLLBACK, classifier.classify("ROLLBACK"));
        assertEquals(StatementCategory.USE, classifier.classify("USE WAREHOUSE wh"));
        assertEquals(StatementCategory.COMMENT, classifier.classify("COMMENT ON TABLE t IS 'x'"));
        assertEquals(StatementCategory.COMMAND, classifier.classify("SHOW TABLES"));
        assertEquals(StatementCategory.COMMAND, classifier.classify("GRANT SELECT ON t TO ROLE r"));
    }

    @Test
    void testTransactionForms() {
        assertEquals(StatementCategory.TRANSACTION, classifier.classify("BEGIN"));
        assertEquals(StatementCategory.TRANSACTION, classifier.classify("BEGIN TRANSACTION"));
        assertEquals(StatementCategory.TRANSACTION, classifier.classify("start transaction"));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify("BEGIN LET x := 1; END"));
    }

    @Test
    @DisplayName("Comments, whitespace and parentheses before the keyword are skipped")
    void testTriviaIsSkipped() {
        assertEquals(StatementCategory.SELECT, classifier.classify("  -- leading comment\n  SELECT 1"));
        assertEquals(StatementCategory.DROP, classifier.classify("/* hidden */ DROP TABLE t"));
        assertEquals(StatementCategory.SELECT, classifier.classify("((SELECT 1) UNION (SELECT 2))"));
    }

    @Test
    void testCommonTableExpressions() {
        assertEquals(StatementCategory.SELECT,
            classifier.classify("WITH a AS (SELECT 1 AS x), b AS (SELECT x FROM a) SELECT * FROM b"));
        assertEquals(StatementCategory.INSERT,
            classifier.classify("WITH src AS (SELECT 1) INSERT INTO t SELECT * FROM src"));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify("WITH a AS (SELECT 1)"));
    }

    @Test
    void testUnrecognizedInputIsUnknown() {
        assertEquals(StatementCategory.UNKNOWN, classifier.classify(null));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify(""));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify("   "));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify("-- only a comment"));
        assertEquals(StatementCategory.UNKNOWN, classifier.classify("FROBNICATE everything"));
    }

    @Test
    void testSplitOnTopLevelSemicolons() {
        List<String> statements = classifier.split("SELECT 1; DROP TABLE x;");
        assertEquals(List.of("SELECT 1", "DROP TABLE x"), statements);
    }

    @Test
    void testSplitIgnoresQuotedSemicolons() {
        assertEquals(1, classifier.split("SELECT 'a;b', \"c;d\" FROM t").size());
        assertEquals(1, classifier.split("SELECT 1 -- trailing; comment").size());
        assertEquals(1, classifier.split("CREATE FUNCTION f() RETURNS INT AS $$ 1; $$").size());
        assertEquals(1, classifier.split("SELECT 'it''s; fine'").size());
    }

    @Test
    void testSplitDropsEmptyPieces() {
        assertTrue(classifier.split("  ;  ; -- nothing\n").isEmpty());
        assertTrue(classifier.split(null).isEmpty());
        assertEquals(1, classifier.split("SELECT 1;;").size());
    }
}
