package io.quarkus.qe.git.content.search.match.impl;

import io.quarkus.qe.git.content.search.TestLoggerProfile;
import io.quarkus.qe.git.content.search.match.ContentMatcherSelector;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@QuarkusTest
@TestProfile(TestLoggerProfile.class)
class ContentMatcherSelectorImplTest {

    @Inject
    ContentMatcherSelector contentMatcherSelector;

    @Test
    void selectsSpreadsheetMatcherForWorkbooks() {
        assertInstanceOf(SpreadsheetContentMatcher.class, contentMatcherSelector.select("finance/budget.xlsx"));
        assertInstanceOf(SpreadsheetContentMatcher.class, contentMatcherSelector.select("finance/Macros.XLSM"));
    }

    @Test
    void fallsBackToPlainText() {
        assertInstanceOf(PlainTextContentMatcher.class, contentMatcherSelector.select("src/Main.java"));
        assertInstanceOf(PlainTextContentMatcher.class, contentMatcherSelector.select("legacy/budget.xls"));
    }
}
