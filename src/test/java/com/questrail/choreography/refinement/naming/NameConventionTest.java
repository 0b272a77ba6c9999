package com.questrail.choreography.refinement.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NameConventionTest
{
    private final NameConvention defaults = PrefixNameConvention.defaults();

    @Test
    void namesMatchIgnoringCase() {
        assertTrue(defaults.motionMatches("MoveTo", "moveto"));
        assertTrue(defaults.messageMatches("GO", "go"));
        assertFalse(defaults.motionMatches("moveTo", "moveFrom"));
    }

    @Test
    void programNamesMayCarryTheKindPrefix() {
        assertTrue(defaults.motionMatches("m_moveTo", "moveTo"));
        assertTrue(defaults.motionMatches("M_MOVETO", "moveTo"));
        assertTrue(defaults.messageMatches("msg_Go", "Go"));
    }

    @Test
    void prefixesAreNotInterchangeable() {
        assertFalse(defaults.motionMatches("msg_moveTo", "moveTo"));
        assertFalse(defaults.messageMatches("m_Go", "Go"));
    }

    @Test
    void prefixIsOnlyStrippedFromTheProgramSide() {
        assertFalse(defaults.motionMatches("moveTo", "m_moveTo"));
    }

    @Test
    void customPrefixes() {
        PrefixNameConvention custom = new PrefixNameConvention("Motion_", "Msg");

        assertTrue(custom.motionMatches("motion_grip", "grip"));
        assertTrue(custom.messageMatches("MsgStop", "stop"));
        assertFalse(custom.motionMatches("m_grip", "grip"));
    }

    @Test
    void mappingTableTranslatesProgramNames() {
        MappingNameConvention mapping = MappingNameConvention.builder()
                .mapMotion("grip", "closeGripper")
                .mapMessage("halt", "Stop")
                .build();

        assertTrue(mapping.motionMatches("grip", "closeGripper"));
        assertFalse(mapping.motionMatches("grip", "grip"));
        assertTrue(mapping.messageMatches("halt", "Stop"));
    }

    @Test
    void unmappedNamesMustBeEqual() {
        MappingNameConvention mapping = MappingNameConvention.builder().build();

        assertTrue(mapping.motionMatches("release", "release"));
        assertFalse(mapping.motionMatches("Release", "release"));
        assertFalse(mapping.messageMatches("msg_Go", "Go"));
    }
}
