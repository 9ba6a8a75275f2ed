package com.pbxguard.integrity;

import com.pbxguard.Fixtures;
import com.pbxguard.graph.ObjectGraphBuilder;
import com.pbxguard.models.LintConfig;
import com.pbxguard.parser.Parser;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.StringValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityCheckerTest {

    private IntegrityReport check(Document document) throws Exception {
        return check(document, LintConfig.defaults());
    }

    private IntegrityReport check(Document document, LintConfig config) throws Exception {
        return new IntegrityChecker(config).check(new ObjectGraphBuilder().buildLenient(document));
    }

    private DictValue record(Document document, String id) {
        return document.getObjects().get(id).asDict();
    }

    @Test
    void demoProjectIsClean() throws Exception {
        IntegrityReport report = check(Fixtures.demo());
        assertTrue(report.isClean(), report.getViolations().toString());
        assertTrue(report.getViolations().isEmpty(), report.getViolations().toString());
    }

    @Test
    void injectedReferenceYieldsExactlyOneDanglingViolation() throws Exception {
        Document document = Fixtures.demo();
        record(document, Fixtures.APP_GROUP).get("children").asArray().add(IdentValue.of(Fixtures.MISSING));

        List<Violation> dangling = check(document).ofType(ViolationType.DANGLING_REFERENCE);
        assertEquals(1, dangling.size());
        Violation violation = dangling.get(0);
        assertEquals(Fixtures.APP_GROUP, violation.getObjectId());
        assertEquals("children", violation.getField());
        assertEquals(Fixtures.MISSING, violation.getTargetId());
        assertTrue(violation.isBlocking());
    }

    @Test
    void reportsDuplicateIdsOnce() throws Exception {
        Document document = Fixtures.demo();
        DictValue copy = record(document, Fixtures.APP_DELEGATE).deepCopy();
        document.getObjects().append(Fixtures.APP_DELEGATE, null, copy, "PBXFileReference");
        document.getObjects().append(Fixtures.APP_DELEGATE, null, copy.deepCopy(), "PBXFileReference");

        List<Violation> duplicates = check(document).ofType(ViolationType.DUPLICATE_ID);
        assertEquals(1, duplicates.size());
        assertEquals(Fixtures.APP_DELEGATE, duplicates.get(0).getObjectId());
    }

    @Test
    void reportsMalformedKeysAndStringReferences() throws Exception {
        Document document = Fixtures.demo();
        document.getObjects().append("NOT-AN-ID", null, new DictValue().put("isa", "PBXGroup"), "PBXGroup");
        record(document, Fixtures.MAIN_GROUP).get("children").asArray().add(new StringValue("A0TEST122F0ABCDE0000000Z"));

        List<Violation> malformed = check(document).ofType(ViolationType.MALFORMED_ID);
        assertEquals(2, malformed.size());
        assertTrue(malformed.stream().anyMatch(v -> "NOT-AN-ID".equals(v.getValue())));
        assertTrue(malformed.stream().anyMatch(v -> "A0TEST122F0ABCDE0000000Z".equals(v.getValue())
            && Fixtures.MAIN_GROUP.equals(v.getObjectId())));
    }

    @Test
    void reportsMissingIsa() throws Exception {
        Document document = Fixtures.demo();
        record(document, Fixtures.CONTENT_VIEW).remove("isa");
        List<Violation> missing = check(document).ofType(ViolationType.MISSING_ISA);
        assertEquals(1, missing.size());
        assertEquals(Fixtures.CONTENT_VIEW, missing.get(0).getObjectId());
    }

    @Test
    void reportsMissingRootObject() throws Exception {
        Document document = Fixtures.demo();
        document.getRoot().remove(Document.ROOT_OBJECT_KEY);
        IntegrityReport report = check(document);
        assertEquals(1, report.ofType(ViolationType.MISSING_ROOT_OBJECT).size());
        // the project object lost its only inbound edge
        assertEquals(1, report.ofType(ViolationType.ORPHAN_OBJECT).size());
    }

    @Test
    void orphansWarnByDefaultAndBlockWhenConfigured() throws Exception {
        Document document = Fixtures.demo();
        document.getObjects().append("1A00000000000000000000AA", null,
            new DictValue().put("isa", "PBXGroup"), "PBXGroup");

        Violation orphan = check(document).ofType(ViolationType.ORPHAN_OBJECT).get(0);
        assertFalse(orphan.isBlocking());
        assertEquals("PBXGroup", orphan.getIsa());

        LintConfig strict = new LintConfig();
        strict.setOrphansBlocking(true);
        assertTrue(check(document, strict).hasBlockingViolations());

        LintConfig exempt = new LintConfig();
        exempt.setOrphanExemptIsas(List.of("PBXGroup"));
        assertTrue(check(document, exempt).ofType(ViolationType.ORPHAN_OBJECT).isEmpty());
    }

    @Test
    void externalReferenceFieldsAreNeverDangling() throws Exception {
        Document document = Fixtures.demo();
        DictValue proxy = new DictValue()
            .put("isa", "PBXContainerItemProxy")
            .put("containerPortal", IdentValue.of(Fixtures.PROJECT))
            .put("remoteGlobalIDString", IdentValue.of(Fixtures.MISSING));
        document.getObjects().append("1A00000000000000000000AB", null, proxy, "PBXContainerItemProxy");

        assertTrue(check(document).ofType(ViolationType.DANGLING_REFERENCE).isEmpty());

        LintConfig internal = new LintConfig();
        internal.setExternalReferenceFields(List.of());
        assertEquals(1, check(document, internal).ofType(ViolationType.DANGLING_REFERENCE).size());
    }

    @Test
    void danglingRootReferenceIsReportedFromRoot() throws Exception {
        Document document = Fixtures.demo();
        document.getRoot().put(Document.ROOT_OBJECT_KEY, IdentValue.of(Fixtures.MISSING));
        Violation violation = check(document).ofType(ViolationType.DANGLING_REFERENCE).get(0);
        assertNull(violation.getObjectId());
        assertTrue(violation.getMessage().contains(Violation.ROOT));
    }

    @Test
    void recordInWrongSectionIsAWarning() throws Exception {
        Document document = Fixtures.demo();
        document.getObjects().getEntry(Fixtures.APP_DELEGATE).setSection("PBXGroup");

        IntegrityReport report = check(document);
        List<Violation> sections = report.ofType(ViolationType.UNBALANCED_GROUPED_SECTION);
        assertEquals(2, sections.size());
        assertFalse(report.hasBlockingViolations());
    }

    @Test
    void misnestedMarkersAreReported() throws Exception {
        Document document = Parser.parseDocument("// !$*UTF8*$!\n{ objects = {\n"
            + "/* Begin PBXProject section */\n"
            + "1A0000000000000000000001 = { isa = PBXProject; };\n"
            + "}; rootObject = 1A0000000000000000000001; }");
        List<Violation> sections = check(document).ofType(ViolationType.UNBALANCED_GROUPED_SECTION);
        assertEquals(1, sections.size());
        assertEquals("PBXProject", sections.get(0).getIsa());

        LintConfig noSections = new LintConfig();
        noSections.setCheckSections(false);
        assertTrue(check(document, noSections).getViolations().isEmpty());
    }

    @Test
    void severitiesFollowTheViolationType() {
        List<Violation> fixed = List.of(
            Violation.duplicateId(Fixtures.TARGET),
            Violation.malformedObjectKey("XYZ"),
            Violation.missingIsa(Fixtures.TARGET),
            Violation.missingRootObject(),
            Violation.dangling(Fixtures.APP_GROUP, "children", Fixtures.MISSING),
            Violation.unbalancedSection("PBXGroup", "no End marker"));
        for (Violation violation : fixed) {
            assertEquals(violation.getType().isBlockingByDefault(), violation.isBlocking(), violation.toString());
        }
        assertFalse(ViolationType.ORPHAN_OBJECT.isBlockingByDefault());
        assertTrue(Violation.orphan(Fixtures.TARGET, "PBXNativeTarget", true).isBlocking());
    }
}
