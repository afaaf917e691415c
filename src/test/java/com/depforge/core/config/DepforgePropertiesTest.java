package com.depforge.core.config;

import com.depforge.core.task.CleanFlag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DepforgePropertiesTest {

    @Test
    @DisplayName("defaults match a plain github setup")
    void defaults() {
        var props = new DepforgeProperties();

        assertEquals("git", props.getGitBinary());
        assertEquals("git@github.com:%s/%s", props.getUrlPattern());
        assertEquals(".ts", props.getTsExtension());
        assertEquals("https://github.com/", props.getGit().getUrlPrefix());
        assertFalse(props.getGit().isShallow());
        assertFalse(props.isIgnoreUncommitted());
        assertTrue(props.getClean().isEmpty());
        assertTrue(props.getSources().isEmpty());
    }

    @Test
    @DisplayName("binds sources, submodules and clean flags")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "depforge.git.shallow", "true",
                "depforge.global.ignore-uncommitted", "true",
                "depforge.clean", "reclone,rebuild",
                "depforge.sources[0].name", "modorganizer",
                "depforge.sources[0].org", "ModOrganizer2",
                "depforge.sources[0].repo", "modorganizer",
                "depforge.sources[0].path", "/build/modorganizer",
                "depforge.sources[0].submodules[0].name", "cmake_common",
                "depforge.sources[0].submodules[0].repo", "cmake_common"
        ));

        var props = new Binder(source).bind("depforge", DepforgeProperties.class).get();

        assertTrue(props.getGit().isShallow());
        assertTrue(props.isIgnoreUncommitted());
        assertEquals(Set.of(CleanFlag.RECLONE, CleanFlag.REBUILD), props.getClean());

        var mo = props.getSources().get(0);
        assertEquals("modorganizer", mo.getName());
        assertEquals("master", mo.getBranch());
        assertFalse(mo.isPrebuilt());
        assertEquals("cmake_common", mo.getSubmodules().get(0).getName());
        assertEquals("master", mo.getSubmodules().get(0).getBranch());
    }
}
