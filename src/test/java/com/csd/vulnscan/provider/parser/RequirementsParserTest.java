package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RequirementsParserTest {

    @Test
    void exactPinsAndRangesAreKept() {
        List<Dependency> deps = RequirementsParser.parse("django==4.2.0\nrequests>=2.0,<3.0\n# note\n-e git+https://x\n");
        assertEquals(List.of(
                new Dependency("django", "4.2.0", "PyPI"),
                new Dependency("requests", ">=2.0,<3.0", "PyPI")), deps);
    }

    @Test
    void extrasCommentsAndOptionsAreStripped() {
        String content = """
                --index-url https://pypi.example.org/simple
                -r base.txt
                Flask[async]==2.3.2  # web
                https://example.org/pkg.tar.gz
                numpy
                """;
        List<Dependency> deps = RequirementsParser.parse(content);
        assertEquals(2, deps.size());
        assertEquals(new Dependency("flask", "2.3.2", "PyPI"), deps.get(0));
        assertEquals(new Dependency("numpy", "*", "PyPI"), deps.get(1));
    }

    @Test
    void repeatedLinesAreDeduplicated() {
        List<Dependency> deps = RequirementsParser.parse("six==1.16.0\nsix==1.16.0\nSix==1.16.0\n");
        assertEquals(1, deps.size());
    }
}
