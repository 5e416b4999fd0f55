package org.nostree.nostr.protocol;

import org.junit.Test;
import org.nostree.nostr.EventFixtures;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for the NIP-01 frame codec.
 */
public class RelayMessagesTest {

    @Test
    public void testReqOmitsUnsetFilterFields() {
        Filter filter = Filter.builder()
            .kinds(EventKinds.RELAY_LIST)
            .authors("abc")
            .limit(2)
            .build();

        String req = RelayMessages.req("sub-1", Collections.singletonList(filter));

        assertEquals("[\"REQ\",\"sub-1\",{\"authors\":[\"abc\"],\"kinds\":[10002],\"limit\":2}]", req);
    }

    @Test
    public void testReqWithSeveralFilters() {
        String req = RelayMessages.req("s", Arrays.asList(
                Filter.builder().kinds(1).build(),
                Filter.builder().pTags("p1").since(10).build()));

        assertEquals("[\"REQ\",\"s\",{\"kinds\":[1]},{\"#p\":[\"p1\"],\"since\":10}]", req);
    }

    @Test
    public void testCloseFrame() {
        assertEquals("[\"CLOSE\",\"sub-1\"]", RelayMessages.close("sub-1"));
    }

    @Test
    public void testEventFrameUsesWireFieldNames() {
        Event event = EventFixtures.note(EventFixtures.pubkey(1), 1700000000L, "hello");

        String frame = RelayMessages.event(event);

        assertTrue(frame.startsWith("[\"EVENT\",{"));
        assertTrue(frame.contains("\"created_at\":1700000000"));
        assertTrue(frame.contains("\"id\":\"" + event.getId() + "\""));
    }

    @Test
    public void testParseEvent() {
        Event event = EventFixtures.note(EventFixtures.pubkey(2), 1700000001L, "hi");
        String frame = "[\"EVENT\",\"sub-9\"," + RelayMessages.event(event).substring("[\"EVENT\",".length());

        RelayMessage message = RelayMessages.parse(frame);

        assertEquals(RelayMessage.Type.EVENT, message.getType());
        assertEquals("sub-9", message.getSubscriptionId());
        assertEquals(event.getId(), message.getEvent().getId());
        assertEquals(1700000001L, message.getEvent().getCreatedAt());
        assertTrue(EventIds.hasValidId(message.getEvent()));
    }

    @Test
    public void testParseEventIgnoresUnknownFields() {
        RelayMessage message = RelayMessages.parse(
                "[\"EVENT\",\"s\",{\"id\":\"x\",\"pubkey\":\"y\",\"created_at\":1,\"kind\":1,\"tags\":[],\"content\":\"\",\"sig\":\"z\",\"extra\":true}]");

        assertEquals("x", message.getEvent().getId());
    }

    @Test
    public void testParseEose() {
        RelayMessage message = RelayMessages.parse("[\"EOSE\",\"sub-1\"]");

        assertEquals(RelayMessage.Type.EOSE, message.getType());
        assertEquals("sub-1", message.getSubscriptionId());
    }

    @Test
    public void testParseOk() {
        RelayMessage accepted = RelayMessages.parse("[\"OK\",\"ev1\",true,\"\"]");
        RelayMessage rejected = RelayMessages.parse("[\"OK\",\"ev2\",false,\"blocked: spam\"]");

        assertEquals(RelayMessage.Type.OK, accepted.getType());
        assertEquals("ev1", accepted.getEventId());
        assertTrue(accepted.isAccepted());
        assertFalse(rejected.isAccepted());
        assertEquals("blocked: spam", rejected.getMessage());
    }

    @Test
    public void testParseNoticeAndClosed() {
        RelayMessage notice = RelayMessages.parse("[\"NOTICE\",\"slow down\"]");
        RelayMessage closed = RelayMessages.parse("[\"CLOSED\",\"sub-3\",\"auth-required: login\"]");

        assertEquals(RelayMessage.Type.NOTICE, notice.getType());
        assertEquals("slow down", notice.getMessage());
        assertEquals(RelayMessage.Type.CLOSED, closed.getType());
        assertEquals("sub-3", closed.getSubscriptionId());
        assertEquals("auth-required: login", closed.getMessage());
    }

    @Test
    public void testUnknownLabelIsNotAnError() {
        RelayMessage message = RelayMessages.parse("[\"AUTH\",\"challenge\"]");

        assertEquals(RelayMessage.Type.UNKNOWN, message.getType());
    }

    @Test(expected = MalformedMessageException.class)
    public void testParseRejectsNonJson() {
        RelayMessages.parse("not json");
    }

    @Test(expected = MalformedMessageException.class)
    public void testParseRejectsObject() {
        RelayMessages.parse("{\"type\":\"EVENT\"}");
    }

    @Test(expected = MalformedMessageException.class)
    public void testParseRejectsShortEventFrame() {
        RelayMessages.parse("[\"EVENT\",\"sub\"]");
    }
}
