package com.pbxguard.graph;

import com.pbxguard.Fixtures;
import com.pbxguard.parser.Parser;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.value.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectGraphBuilderTest {

    private static final String HEADER = "// !$*UTF8*$!\n";

    @Test
    void indexesRecordsByIdAndIsa() throws Exception {
        ObjectGraph graph = new ObjectGraphBuilder().build(Fixtures.demo());
        assertEquals(18, graph.size());
        assertEquals(Fixtures.PROJECT, graph.getRootObjectId());
        assertEquals("PBXNativeTarget", graph.get(Fixtures.TARGET).getIsa());
        assertEquals(List.of(Fixtures.APP_DELEGATE_BUILD, Fixtures.CONTENT_VIEW_BUILD),
            List.copyOf(graph.idsOfIsa("PBXBuildFile")));
        assertEquals(4, graph.recordsOfIsa("XCBuildConfiguration").size());
    }

    @Test
    void collectsEdgesWithKinds() throws Exception {
        ObjectGraph graph = new ObjectGraphBuilder().build(Fixtures.demo());
        List<Edge> incoming = graph.incomingEdges(Fixtures.APP_DELEGATE);
        assertEquals(2, incoming.size());
        Edge fromBuildFile = incoming.stream()
            .filter(e -> Fixtures.APP_DELEGATE_BUILD.equals(e.fromId()))
            .findFirst()
            .orElseThrow();
        assertEquals("fileRef", fromBuildFile.field());
        assertEquals(EdgeKind.BUILD_FILE_BACKING, fromBuildFile.kind());

        List<Edge> outgoing = graph.outgoingEdges(Fixtures.APP_DELEGATE_BUILD);
        assertEquals(1, outgoing.size());
        assertEquals(Fixtures.APP_DELEGATE, outgoing.get(0).targetId());

        Edge root = graph.incomingEdges(Fixtures.PROJECT).get(0);
        assertTrue(root.fromRoot());
        assertEquals(EdgeKind.ROOT, root.kind());
    }

    @Test
    void everyRecordIsLiveInTheDemo() throws Exception {
        ObjectGraph graph = new ObjectGraphBuilder().build(Fixtures.demo());
        assertEquals(graph.ids(), graph.liveIds());
    }

    @Test
    void findsRecordsByNameThenPathThenComment() throws Exception {
        ObjectGraph graph = new ObjectGraphBuilder().build(Fixtures.demo());
        assertEquals(Fixtures.TARGET, graph.findByName("Demo").get(0).getId());
        assertEquals(Fixtures.APP_DELEGATE, graph.findByName("AppDelegate.swift").get(0).getId());
        assertEquals(Fixtures.APP_DELEGATE_BUILD,
            graph.findByName("AppDelegate.swift in Sources").get(0).getId());
        assertEquals(2, graph.findByName("Debug").size());
    }

    @Test
    void strictBuildRejectsDuplicates() throws Exception {
        Document document = Parser.parseDocument(HEADER + "{ objects = {\n"
            + "1A0000000000000000000001 = { isa = PBXGroup; };\n"
            + "1A0000000000000000000001 = { isa = PBXGroup; };\n"
            + "}; rootObject = 1A0000000000000000000001; }");
        DuplicateIdentifierException e = assertThrows(DuplicateIdentifierException.class,
            () -> new ObjectGraphBuilder().build(document));
        assertEquals("1A0000000000000000000001", e.getId());

        ObjectGraph lenient = new ObjectGraphBuilder().buildLenient(document);
        assertEquals(1, lenient.size());
        assertEquals(1, lenient.getDuplicates().size());
    }

    @Test
    void missingObjectsDictionaryIsAParseError() throws Exception {
        Document document = Parser.parseDocument(HEADER + "{ rootObject = 1A0000000000000000000001; }");
        assertThrows(ProjectParseException.class, () -> new ObjectGraphBuilder().buildLenient(document));
    }

    @Test
    void buildingDoesNotModifyTheDocument() throws Exception {
        Document document = Fixtures.demo();
        Document copy = document.deepCopy();
        new ObjectGraphBuilder().build(document);
        assertTrue(document.graphEquals(copy));
    }
}
