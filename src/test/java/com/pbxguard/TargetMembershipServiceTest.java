package com.pbxguard;

import com.pbxguard.editor.EditErrorKind;
import com.pbxguard.editor.EditResult;
import com.pbxguard.editor.IdGenerator;
import com.pbxguard.editor.ProjectEditor;
import com.pbxguard.models.LintConfig;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.StringValue;
import com.pbxguard.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TargetMembershipServiceTest {

    private ProjectEditor editor;
    private final TargetMembershipService service = new TargetMembershipService();

    @BeforeEach
    void setUp() throws Exception {
        editor = new ProjectEditor(Fixtures.demo(), LintConfig.defaults(), new IdGenerator(new Random(4)));
    }

    @Test
    void sourceFileIsMemberOfItsTarget() throws Exception {
        TargetMembershipService.Membership membership =
            service.check(editor.getGraph(), "AppDelegate.swift", "Demo", "Sources");

        assertTrue(membership.targetFound());
        assertTrue(membership.isMember());
        assertEquals(Fixtures.TARGET, membership.targetId());
        assertEquals(List.of(Fixtures.SOURCES_PHASE), membership.phaseIds());
        assertEquals(List.of(Fixtures.APP_DELEGATE_BUILD), membership.buildFileIds());
    }

    @Test
    void otherPhasesAndTargetsDoNotMatch() throws Exception {
        assertFalse(service.check(editor.getGraph(), "AppDelegate.swift", "Demo", "Frameworks").isMember());
        assertFalse(service.check(editor.getGraph(), "Missing.swift", "Demo", "Sources").isMember());
        assertFalse(service.check(editor.getGraph(), "AppDelegate.swift", "Nope", "Sources").targetFound());
    }

    @Test
    void fileNameMatchesTheLastPathComponent() throws Exception {
        editor.setField(Fixtures.CONTENT_VIEW, "path", new StringValue("Views/ContentView.swift"));
        assertTrue(service.check(editor.getGraph(), "ContentView.swift", "Demo", "Sources").isMember());
        assertFalse(service.check(editor.getGraph(), "View.swift", "Demo", "Sources").isMember());
    }

    @Test
    void addToTargetCreatesAndLinksABuildFile() throws Exception {
        EditResult<String> result = service.addToTarget(editor, "Demo.app", "Demo", "Frameworks");

        assertTrue(result.isSuccess(), String.valueOf(result));
        String buildFileId = result.getValue();
        DictValue buildFile = editor.getDocument().getObjects().get(buildFileId).asDict();
        assertEquals("PBXBuildFile", buildFile.getString("isa"));
        assertEquals(Fixtures.PRODUCT, buildFile.getString("fileRef"));
        IdentValue edge = editor.getDocument().getObjects().get(Fixtures.FRAMEWORKS_PHASE).asDict()
            .get("files").asArray().get(0).asIdent();
        assertEquals(buildFileId, edge.getId());
        assertEquals("Demo.app in Frameworks", edge.getComment());
        assertEquals("Demo.app in Frameworks", editor.getDocument().getObjects().getEntry(buildFileId).getKeyComment());
        assertTrue(service.check(editor.getGraph(), "Demo.app", "Demo", "Frameworks").isMember());
        assertTrue(editor.getReport().isClean(), editor.getReport().getViolations().toString());
    }

    @Test
    void addToTargetRefusesExistingMembers() throws Exception {
        EditResult<String> result = service.addToTarget(editor, "AppDelegate.swift", "Demo", "Sources");
        assertEquals(EditErrorKind.DUPLICATE_EDGE, result.getErrorKind());
        assertEquals(18, editor.getGraph().size());
    }

    @Test
    void addToTargetReportsWhatIsMissing() throws Exception {
        assertEquals(EditErrorKind.TARGET_NOT_FOUND,
            service.addToTarget(editor, "AppDelegate.swift", "Nope", "Sources").getErrorKind());
        assertEquals(EditErrorKind.TARGET_NOT_FOUND,
            service.addToTarget(editor, "Nope.swift", "Demo", "Sources").getErrorKind());
        assertEquals(EditErrorKind.OBJECT_NOT_FOUND,
            service.addToTarget(editor, "AppDelegate.swift", "Demo", "Resources").getErrorKind());
    }

    @Test
    void ambiguousNamesAreUsageErrors() throws Exception {
        editor.addObject("PBXFileReference", new DictValue().put("path", "AppDelegate.swift"));
        assertThrows(UsageException.class,
            () -> service.addToTarget(editor, "AppDelegate.swift", "Demo", "Sources"));
        assertEquals(Fixtures.APP_DELEGATE,
            ObjectResolver.resolve(editor.getGraph(), Fixtures.APP_DELEGATE));
    }

    @Test
    void importFileLinksReferenceGroupAndBuildFileTogether() throws Exception {
        EditResult<TargetMembershipService.ImportedFile> result =
            service.importFile(editor, "Views/Settings.swift", "App", "Demo", "Sources");

        assertTrue(result.isSuccess(), String.valueOf(result));
        String fileId = result.getValue().fileId();
        DictValue file = editor.getDocument().getObjects().get(fileId).asDict();
        assertEquals("PBXFileReference", file.getString("isa"));
        assertEquals("Views/Settings.swift", file.getString("path"));
        assertEquals("sourcecode.swift", file.getString("lastKnownFileType"));
        assertEquals("<group>", file.getString("sourceTree"));
        assertEquals("Settings.swift", editor.getDocument().getObjects().getEntry(fileId).getKeyComment());

        List<Value> children = editor.getDocument().getObjects().get(Fixtures.APP_GROUP).asDict()
            .get("children").asArray().getElements();
        assertEquals(IdentValue.of(fileId), children.get(children.size() - 1));
        assertEquals("Settings.swift", children.get(children.size() - 1).asIdent().getComment());

        IdentValue built = editor.getDocument().getObjects().get(Fixtures.SOURCES_PHASE).asDict()
            .get("files").asArray().get(2).asIdent();
        assertEquals(result.getValue().buildFileId(), built.getId());
        assertEquals("Settings.swift in Sources", built.getComment());
        assertTrue(service.check(editor.getGraph(), "Settings.swift", "Demo", "Sources").isMember());
        assertEquals(20, editor.getGraph().size());
        assertTrue(editor.getReport().isClean(), editor.getReport().getViolations().toString());
    }

    @Test
    void importFileRefusesAFileTheGroupAlreadyHas() throws Exception {
        EditResult<TargetMembershipService.ImportedFile> result =
            service.importFile(editor, "AppDelegate.swift", "App", "Demo", "Sources");
        assertEquals(EditErrorKind.DUPLICATE_EDGE, result.getErrorKind());
        assertEquals(18, editor.getGraph().size());
    }

    @Test
    void importFileReportsWhatIsMissing() throws Exception {
        assertEquals(EditErrorKind.OBJECT_NOT_FOUND,
            service.importFile(editor, "A.swift", "Nowhere", "Demo", "Sources").getErrorKind());
        assertEquals(EditErrorKind.TARGET_NOT_FOUND,
            service.importFile(editor, "A.swift", "App", "Nope", "Sources").getErrorKind());
        assertEquals(EditErrorKind.OBJECT_NOT_FOUND,
            service.importFile(editor, "A.swift", "App", "Demo", "Resources").getErrorKind());
    }

    @Test
    void importFileLeavesNothingBehindWhenALaterStepFails() throws Exception {
        editor.setField(Fixtures.APP_GROUP, "children", new StringValue("broken"));

        EditResult<TargetMembershipService.ImportedFile> result =
            service.importFile(editor, "Settings.swift", "App", "Demo", "Sources");

        assertEquals(EditErrorKind.INVALID_FIELD, result.getErrorKind());
        assertEquals(18, editor.getGraph().size());
        assertTrue(editor.getGraph().findByName("Settings.swift").isEmpty());
        assertEquals(2, editor.getDocument().getObjects().get(Fixtures.SOURCES_PHASE).asDict()
            .get("files").asArray().size());
    }

    @Test
    void fileTypesFollowTheExtension() {
        assertEquals("sourcecode.swift", TargetMembershipService.fileTypeOf("A.swift"));
        assertEquals("sourcecode.c.objc", TargetMembershipService.fileTypeOf("B.m"));
        assertEquals("folder.assetcatalog", TargetMembershipService.fileTypeOf("Assets.xcassets"));
        assertEquals("text", TargetMembershipService.fileTypeOf("README"));
    }

    @Test
    void phaseNames() {
        assertEquals("PBXSourcesBuildPhase", TargetMembershipService.phaseIsa("Sources"));
        assertEquals("PBXCopyFilesBuildPhase", TargetMembershipService.phaseIsa("copyfiles"));
        assertEquals("PBXResourcesBuildPhase", TargetMembershipService.phaseIsa("PBXResourcesBuildPhase"));
        assertEquals("PBXRezBuildPhase", TargetMembershipService.phaseIsa("Rez"));
    }
}
