package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PoetryParserTest {

    private static final String LOCK = """
            [[package]]
            name = "requests"
            version = "2.31.0"
            category = "main"

            [[package]]
            name = "pytest"
            version = "7.4.0"
            category = "dev"

            [[package]]
            name = "urllib3"
            version = "2.0.4"
            """;

    private static final String PYPROJECT = """
            [tool.poetry]
            name = "demo"

            [tool.poetry.dependencies]
            python = "^3.11"
            requests = "^2.31"
            "ruamel.yaml" = { version = "0.17.32", optional = true }

            [tool.poetry.dev-dependencies]
            black = "23.7.0"

            [tool.poetry.group.dev.dependencies]
            pytest = "^7.4"
            """;

    @Test
    void lockfileSkipsDevCategoryUnlessRequested() {
        List<Dependency> deps = PoetryParser.parseLockfile(LOCK, false);
        assertEquals(List.of(
                new Dependency("requests", "2.31.0", "PyPI"),
                new Dependency("urllib3", "2.0.4", "PyPI")), deps);

        assertEquals(3, PoetryParser.parseLockfile(LOCK, true).size());
    }

    @Test
    void pyprojectReadsMainSectionWithoutPython() {
        List<Dependency> deps = PoetryParser.parsePyproject(PYPROJECT, false);
        assertEquals(List.of(
                new Dependency("requests", "^2.31", "PyPI"),
                new Dependency("ruamel.yaml", "0.17.32", "PyPI")), deps);
    }

    @Test
    void pyprojectDevSectionsBothFormats() {
        List<Dependency> deps = PoetryParser.parsePyproject(PYPROJECT, true);
        assertEquals(4, deps.size());
        assertEquals("black", deps.get(2).getName());
        assertEquals("pytest", deps.get(3).getName());
    }

    @Test
    void detectsPoetryProjects() {
        assertTrue(PoetryParser.isPoetryProject(PYPROJECT));
        assertFalse(PoetryParser.isPoetryProject("[project]\nname = \"plain\"\n"));
    }

    @Test
    void parsingIsRepeatable() {
        assertEquals(PoetryParser.parseLockfile(LOCK, true), PoetryParser.parseLockfile(LOCK, true));
    }
}
