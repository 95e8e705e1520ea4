package io.intellixity.vigil.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QuerySpecParserTest {
  private final QuerySpecParser parser = new QuerySpecParser();

  @Test
  void singleValueBecomesMatchCondition() {
    QueryElement el = parser.parseValue("severity", "critical");
    assertEquals(QueryFilters.match("severity", "critical"), el);
  }

  @Test
  void rangePrefixesBecomeRangeConditions() {
    assertEquals(QueryFilters.ge("duration", "5"), parser.parseValue("duration", "gte:5"));
    assertEquals(QueryFilters.gt("duration", "5"), parser.parseValue("duration", "gt:5"));
    assertEquals(QueryFilters.le("duration", "10"), parser.parseValue("duration", "lte:10"));
    assertEquals(QueryFilters.lt("duration", "10"), parser.parseValue("duration", "lt:10"));
  }

  @Test
  void rangeOperandKeepsCommasAndIsNotAnOrList() {
    Condition c = (Condition) parser.parseValue("duration", "gte:1,5");
    assertEquals(Operator.GE, c.operator());
    assertEquals("1,5", c.value());
  }

  @Test
  void prefixWithoutOperandIsPlainText() {
    assertEquals(QueryFilters.match("name", "gte:"), parser.parseValue("name", "gte:"));
  }

  @Test
  void commaValueBecomesOrGroupOfTrimmedValues() {
    QueryElement el = parser.parseValue("severity", "critical, warning, ");
    assertTrue(el instanceof LogicalGroup);
    LogicalGroup g = (LogicalGroup) el;
    assertEquals(Clause.OR, g.clause());
    assertEquals(List.of(
        QueryFilters.match("severity", "critical"),
        QueryFilters.match("severity", "warning"),
        QueryFilters.match("severity", "")
    ), g.elements());
  }

  @Test
  void repeatedKeysAndDistinctKeysAreAnded() {
    QuerySpec spec = QuerySpec.builder()
        .add("severity", "critical")
        .add("duration", "gte:5")
        .add("duration", "lte:10")
        .build();

    QueryElement filter = parser.parse(spec).filter();
    assertEquals(QueryFilters.and(
        QueryFilters.match("severity", "critical"),
        QueryFilters.ge("duration", "5"),
        QueryFilters.le("duration", "10")
    ), filter);
  }

  @Test
  void reservedKeysAreNotFilters() {
    QuerySpec spec = QuerySpec.of(Map.of("page", "2", "limit", "5", "sort", "name", "fields", "name"));
    Query q = parser.parse(spec);
    assertNull(q.filter());
    assertEquals(new PageRequest(2, 5), q.page());
    assertEquals(List.of(SortField.asc("name")), q.sort());
    assertEquals(List.of("name"), q.projection());
  }

  @Test
  void sortParsesDirectionsAndSkipsBlanks() {
    assertEquals(
        List.of(SortField.desc("duration"), SortField.asc("name")),
        parser.parseSort("-duration, name,,-")
    );
    assertEquals(List.of(), parser.parseSort(null));
  }

  @Test
  void fieldsAreTrimmedAndDeduplicated() {
    assertEquals(List.of("name", "severity"), parser.parseFields(" name,severity,name, "));
    assertNull(parser.parseFields(""));
    assertNull(parser.parseFields(null));
    assertEquals(List.of(), parser.parseFields(" , "));
  }

  @Test
  void emptySpecCompilesToDefaults() {
    Query q = parser.parse(QuerySpec.empty());
    assertNull(q.filter());
    assertTrue(q.sort().isEmpty());
    assertNull(q.projection());
    assertEquals(PageRequest.defaults(), q.page());
  }
}
