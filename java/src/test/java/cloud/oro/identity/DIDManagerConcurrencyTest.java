package cloud.oro.identity;

import cloud.oro.identity.store.InMemoryDIDStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DIDManagerConcurrencyTest {

    @Test
    void concurrentLinksFromSeveralManagersConvergeOnOneCluster() throws Exception {
        InMemoryDIDStore store = new InMemoryDIDStore();
        DIDManager setup = new DIDManager(store);
        List<DIDNode> nodes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            nodes.add(setup.createDid("device-" + i));
        }

        // pairs (0,1) (2,3) ... first, then a chain over the pair heads, all racing
        List<int[]> links = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i += 2) {
            links.add(new int[]{i, i + 1});
        }
        for (int i = 1; i < nodes.size() - 1; i += 2) {
            links.add(new int[]{i, i + 1});
        }

        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LinkProof>> futures = new ArrayList<>();
            for (int[] link : links) {
                DIDManager manager = new DIDManager(store);
                DIDNode a = nodes.get(link[0]);
                DIDNode b = nodes.get(link[1]);
                Callable<LinkProof> task = () -> {
                    start.await();
                    return manager.linkDids(a.getDid(), a.getPrivateKey(), b.getDid(), b.getPrivateKey());
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<LinkProof> future : futures) {
                assertNotNull(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        List<IdentityCluster> clusters = setup.listClusters();
        assertEquals(1, clusters.size());
        IdentityCluster cluster = clusters.get(0);
        Set<String> expected = new HashSet<>();
        for (DIDNode node : nodes) {
            expected.add(node.getDid());
            assertEquals(cluster.clusterId(), store.getNode(node.getDid()).getClusterId());
        }
        assertEquals(expected, cluster.memberDids());
        assertEquals(links.size(), store.listProofs().size());
        for (LinkProof proof : store.listProofs()) {
            assertTrue(setup.verifyLinkProof(proof));
        }
    }

    @Test
    void readersSeeConsistentMembershipDuringWrites() throws Exception {
        InMemoryDIDStore store = new InMemoryDIDStore();
        DIDManager manager = new DIDManager(store);
        DIDNode anchor = manager.createDid("anchor");
        List<DIDNode> others = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            others.add(manager.createDid("n" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = pool.submit(() -> {
                for (DIDNode other : others) {
                    manager.linkDids(anchor.getDid(), anchor.getPrivateKey(), other.getDid(), other.getPrivateKey());
                }
                return null;
            });
            Future<?> reader = pool.submit(() -> {
                while (!writer.isDone()) {
                    for (IdentityCluster cluster : manager.listClusters()) {
                        for (String member : cluster.memberDids()) {
                            assertEquals(cluster.clusterId(), manager.getNode(member).getClusterId());
                        }
                    }
                }
                return null;
            });
            writer.get(30, TimeUnit.SECONDS);
            reader.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(11, manager.resolveIdentity(anchor.getDid()).orElseThrow().size());
    }
}
