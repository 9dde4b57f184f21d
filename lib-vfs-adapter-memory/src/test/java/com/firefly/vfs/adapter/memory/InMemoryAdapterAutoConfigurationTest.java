package com.firefly.vfs.adapter.memory;

import com.firefly.core.vfs.config.VfsAutoConfiguration;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.domain.model.ordering.InsertPosition;
import com.firefly.core.vfs.ordering.CrossFolderMoveOrchestrator;
import com.firefly.core.vfs.service.DocumentTreeService;
import com.firefly.core.vfs.service.VfsPortProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static com.firefly.core.vfs.testing.OrdinalAssertions.assertCommittedOrder;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {InMemoryAdapterAutoConfiguration.class, VfsAutoConfiguration.class})
@TestPropertySource(properties = {
        "firefly.vfs.adapter-type=memory",
        "firefly.vfs.adapter.memory.root-owner-id=7",
        "firefly.vfs.adapter.memory.root-public=true"
})
class InMemoryAdapterAutoConfigurationTest {

    @Autowired
    private VfsPortProvider portProvider;

    @Autowired
    private InMemoryNodeStoreAdapter adapter;

    @Autowired
    private DocumentTreeService documentTreeService;

    @Autowired
    private CrossFolderMoveOrchestrator orchestrator;

    @Test
    void adapterSelected_forMemoryType() {
        assertThat(portProvider.getNodeStorePort()).containsSame(adapter);
        assertThat(portProvider.getNodeContentPort()).containsSame(adapter);
    }

    @Test
    void rootProperties_appliedToCreatedNodes() {
        TreeNode folder = documentTreeService.createFolder("/", "owned", InsertPosition.atEnd()).block();

        assertThat(folder.getOwnerId()).isEqualTo(7L);
        assertThat(folder.getPublicNode()).isTrue();
    }

    @Test
    void engineBeans_operateOnSelectedAdapter() {
        documentTreeService.createFolder("/", "from", InsertPosition.atEnd()).block();
        documentTreeService.createFolder("/", "to", InsertPosition.atEnd()).block();
        documentTreeService.createFile("/from", "one", InsertPosition.atEnd(), "1").block();
        documentTreeService.createFile("/from", "two", InsertPosition.atEnd(), "2").block();
        documentTreeService.createFile("/to", "existing", InsertPosition.atEnd(), "x").block();

        orchestrator.paste(List.of("/from/two.md", "/from/one.md"), "/to", InsertPosition.atBeginning()).block();

        assertCommittedOrder(adapter, "/to", "two.md", "one.md", "existing.md");
        assertThat(documentTreeService.readFile("/to", "one.md").block()).isEqualTo("1");
    }
}
