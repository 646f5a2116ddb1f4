package io.intellixity.datastore.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlStatementsTest {

  @Test
  void singleSelectIsAccepted() {
    assertTrue(SqlStatements.isSingleStatement("SELECT * FROM \"abc123\""));
    assertTrue(SqlStatements.isSingleStatement("SELECT 1;"));
    assertTrue(SqlStatements.isSingleStatement("  SELECT 1 ;  ; "));
  }

  @Test
  void stackedStatementsAreRejected() {
    assertFalse(SqlStatements.isSingleStatement("SELECT 1; DROP TABLE x"));
    assertFalse(SqlStatements.isSingleStatement("SELECT 1;SELECT 2;"));
  }

  @Test
  void semicolonInsideLiteralsDoesNotSplit() {
    assertTrue(SqlStatements.isSingleStatement("SELECT 'a;b' FROM t"));
    assertTrue(SqlStatements.isSingleStatement("SELECT 'it''s; fine'"));
    assertTrue(SqlStatements.isSingleStatement("SELECT \"col;name\" FROM \"t\""));
    assertTrue(SqlStatements.isSingleStatement("SELECT $$ ; $$"));
    assertTrue(SqlStatements.isSingleStatement("SELECT $fn$ ; DROP TABLE x; $fn$"));
  }

  @Test
  void commentsDoNotHideStatements() {
    assertTrue(SqlStatements.isSingleStatement("SELECT 1 -- ; DROP TABLE x"));
    assertTrue(SqlStatements.isSingleStatement("SELECT /* ; */ 1"));
    assertTrue(SqlStatements.isSingleStatement("SELECT /* outer /* ; */ still comment ; */ 1"));
    assertFalse(SqlStatements.isSingleStatement("SELECT 1 /* c */; DROP TABLE x"));
    assertFalse(SqlStatements.isSingleStatement("SELECT 1 --c\n; DELETE FROM x"));
  }

  @Test
  void escapeStringBackslashQuoteDoesNotHideStatements() {
    assertFalse(SqlStatements.isSingleStatement(
        "SELECT E'\\''; SET statement_timeout = 0; SELECT pg_sleep(100000); --'"));
    assertEquals(3, SqlStatements.split("SELECT e'\\''; SET statement_timeout = 0; SELECT 1 --'").size());
    assertTrue(SqlStatements.isSingleStatement("SELECT E'a\\'; b' FROM t"));
    assertTrue(SqlStatements.isSingleStatement("SELECT E'it''s; fine'"));
  }

  @Test
  void standardStringKeepsBackslashLiteral() {
    // outside E'...' a backslash is an ordinary character
    assertFalse(SqlStatements.isSingleStatement("SELECT '\\'; DROP TABLE x; --'"));
    assertFalse(SqlStatements.isSingleStatement("SELECT 1 AS namE'\\'; DROP TABLE x; --'"));
  }

  @Test
  void dollarInsideIdentifierIsNotADollarQuote() {
    assertFalse(SqlStatements.isSingleStatement("SELECT 1 AS a$b$; DROP TABLE x; SELECT 1 AS c$b$"));
    assertTrue(SqlStatements.isSingleStatement("SELECT 1 AS a$b$ FROM t"));
    assertTrue(SqlStatements.isSingleStatement("SELECT $b$ ; $b$ AS a$b"));
  }

  @Test
  void emptyAndCommentOnlyInputHasNoStatement() {
    assertFalse(SqlStatements.isSingleStatement(""));
    assertFalse(SqlStatements.isSingleStatement(";;"));
    assertFalse(SqlStatements.isSingleStatement("-- nothing"));
    assertFalse(SqlStatements.isSingleStatement(null));
  }

  @Test
  void splitTrimsStatements() {
    assertEquals(List.of("SELECT 1", "SELECT 2"), SqlStatements.split(" SELECT 1 ;\n SELECT 2 "));
  }
}
