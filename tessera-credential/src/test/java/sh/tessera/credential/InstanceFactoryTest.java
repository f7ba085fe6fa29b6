// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.tessera.core.credential.InstanceCreated;
import sh.tessera.core.credential.MetadataChanged;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.error.AddressOccupiedException;
import sh.tessera.core.error.AlreadyInitializedException;
import sh.tessera.core.error.InvalidOwnerException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.credential.auth.InMemorySubjectRegistry;
import sh.tessera.credential.event.EventLog;

class InstanceFactoryTest {

    private static final Address DEPLOYER = new Address("0x" + "de".repeat(20));
    private static final Address CREATOR = new Address("0x" + "c0".repeat(20));
    private static final Address OTHER = new Address("0x" + "0f".repeat(20));
    private static final Address MALLORY = new Address("0x" + "99".repeat(20));

    private Deployments deployments;
    private Address registry;
    private EventLog events;
    private InstanceFactory factory;

    @BeforeEach
    void setUp() {
        deployments = new Deployments();
        registry = deployments.deployRegistry(DEPLOYER, new InMemorySubjectRegistry());
        events = new EventLog();
        factory = InstanceFactory.deploy(deployments, DEPLOYER, CredentialOptions.builder().eventSink(events).build());
    }

    @Test
    void deterministicAddressMatchesPrediction() {
        Hash salt = Keccak256.hashUtf8("widget-v1");
        Address predicted = factory.predictAddress(salt);

        Address created = factory.createDeterministic(CREATOR, registry, "Widget", salt);

        assertEquals(predicted, created);
        assertEquals(CloneAddresses.predict(factory.address(), salt, factory.template().address()), created);
        assertTrue(factory.isFactoryInstance(created));
    }

    @Test
    void predictionIsIndependentOfCaller() {
        Hash salt = Keccak256.hashUtf8("shared");
        Address predicted = factory.predictAddress(salt);
        assertEquals(predicted, factory.createDeterministic(OTHER, registry, null, salt));
    }

    @Test
    void distinctSaltsGiveDistinctAddresses() {
        assertNotEquals(
            factory.predictAddress(Keccak256.hashUtf8("a")),
            factory.predictAddress(Keccak256.hashUtf8("b")));
    }

    @Test
    void reusedSaltIsRejected() {
        Hash salt = Keccak256.hashUtf8("once");
        Address first = factory.createDeterministic(CREATOR, registry, "First", salt);

        AddressOccupiedException ex = assertThrows(AddressOccupiedException.class,
            () -> factory.createDeterministic(OTHER, registry, "Second", salt));

        assertEquals(first, ex.address());
        assertEquals(1, factory.instanceCount());
        assertEquals(CREATOR, factory.instance(first).orElseThrow().owner());
    }

    @Test
    void createReturnsFreshAddresses() {
        Address a = factory.create(CREATOR, registry, "A");
        Address b = factory.create(CREATOR, registry, "B");
        assertNotEquals(a, b);
    }

    @Test
    void zeroCreatorIsRejected() {
        assertThrows(InvalidOwnerException.class, () -> factory.create(Address.ZERO, registry, "x"));
        assertThrows(InvalidOwnerException.class,
            () -> factory.createDeterministic(Address.ZERO, registry, "x", Keccak256.hashUtf8("s")));
        assertEquals(0, factory.instanceCount());
    }

    @Test
    void instancesShareTemplateButNotStorage() {
        CredentialInstance a = factory.instance(factory.create(CREATOR, registry, "A")).orElseThrow();
        CredentialInstance b = factory.instance(factory.create(CREATOR, registry, "B")).orElseThrow();

        assertEquals(factory.template().address(), a.implementation());
        assertEquals(factory.template().address(), b.implementation());
        assertNotSame(a.storage(), b.storage());
        assertEquals(InstanceState.INITIALIZED, a.state());
    }

    @Test
    void templateCanNeverBeInitialized() {
        CredentialInstance template = factory.template();
        assertEquals(InstanceState.TEMPLATE, template.state());
        assertThrows(AlreadyInitializedException.class, () -> template.initialize(registry, CREATOR, "Mine"));
        assertTrue(template.owner().isZero());
    }

    @Test
    void createdInstanceCannotBeReinitialized() {
        CredentialInstance instance = factory.instance(factory.create(CREATOR, registry, "A")).orElseThrow();
        assertThrows(AlreadyInitializedException.class, () -> instance.initialize(registry, OTHER, "B"));
    }

    @Test
    void tracksInstancesPerCreator() {
        Address a = factory.create(CREATOR, registry, "A");
        Address b = factory.create(OTHER, registry, "B");
        Address c = factory.createDeterministic(CREATOR, registry, "C", Keccak256.hashUtf8("c"));

        assertEquals(List.of(a, b, c), factory.allInstances());
        assertEquals(List.of(a, c), factory.instancesOf(CREATOR));
        assertEquals(List.of(b), factory.instancesOf(OTHER));
        assertEquals(List.of(), factory.instancesOf(DEPLOYER));
        assertEquals(3, factory.instanceCount());
        assertEquals(2, factory.instanceCountOf(CREATOR));
        assertEquals(0, factory.instanceCountOf(DEPLOYER));
    }

    @Test
    void foreignAddressesAreNotInstances() {
        CredentialInstance standalone = CredentialInstance.deploy(deployments, CREATOR, registry);

        assertFalse(factory.isFactoryInstance(standalone.address()));
        assertFalse(factory.isFactoryInstance(factory.template().address()));
        assertTrue(factory.instance(standalone.address()).isEmpty());
    }

    @Test
    void emptyNameWritesNothing() {
        CredentialInstance instance = factory.instance(factory.create(CREATOR, registry, "")).orElseThrow();

        assertArrayEquals(new byte[0], instance.getInstanceMetadata("name"));
        assertTrue(events.eventsOfType(MetadataChanged.class).isEmpty());
    }

    @Test
    void customNameKey() {
        InstanceFactory custom = InstanceFactory.deploy(deployments, DEPLOYER,
            CredentialOptions.builder().nameKey("title").eventSink(events).build());
        CredentialInstance instance = custom.instance(custom.create(CREATOR, registry, "Widget")).orElseThrow();

        assertArrayEquals("Widget".getBytes(), instance.getInstanceMetadata("title"));
        assertArrayEquals(new byte[0], instance.getInstanceMetadata("name"));
    }

    @Test
    void emitsInstanceCreatedLast() {
        Address created = factory.create(CREATOR, registry, "Widget");

        InstanceCreated event = (InstanceCreated) events.events().get(events.size() - 1);
        assertEquals(new InstanceCreated(factory.address(), created, registry, "Widget", CREATOR), event);
        assertEquals(3, events.eventsFrom(created).size());
    }

    @Test
    void factoriesPredictDifferentAddresses() {
        InstanceFactory second = InstanceFactory.deploy(deployments, DEPLOYER);
        Hash salt = Keccak256.hashUtf8("same");
        assertNotEquals(factory.predictAddress(salt), second.predictAddress(salt));
    }

    @Test
    void deterministicCloneIsInitializedBeforeItIsReachable() {
        Hash salt = Keccak256.hashUtf8("contested");
        Address predicted = factory.predictAddress(salt);

        Address created;
        try (InitializeOnDeploy intruder = new InitializeOnDeploy(deployments, MALLORY)) {
            created = factory.createDeterministic(CREATOR, registry, "Widget", salt);

            assertEquals(List.of(InstanceState.INITIALIZED), intruder.observedStates);
            assertEquals(1, intruder.rejections.size());
            assertTrue(intruder.takenOver.isEmpty());
        }

        CredentialInstance instance = factory.instance(created).orElseThrow();
        assertEquals(predicted, created);
        assertEquals(CREATOR, instance.owner());
        assertArrayEquals("Widget".getBytes(), instance.getInstanceMetadata("name"));
        assertEquals(List.of(created), factory.instancesOf(CREATOR));
    }

    @Test
    void eventsFollowPublication() {
        List<Boolean> reachableAtEmit = new ArrayList<>();
        InstanceFactory observed = InstanceFactory.deploy(deployments, DEPLOYER, CredentialOptions.builder()
            .eventSink(event -> reachableAtEmit.add(deployments.isOccupied(event.source())))
            .build());

        observed.create(CREATOR, registry, "Widget");

        assertEquals(List.of(true, true, true, true), reachableAtEmit);
    }

    @Test
    void concurrentCreatesWithOneSaltProduceOneInstance() throws Exception {
        Hash salt = Keccak256.hashUtf8("race");
        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Address>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            Address creator = new Address(String.format("0x%040x", i + 1));
            futures.add(executor.submit(() -> {
                startLatch.await();
                try {
                    return factory.createDeterministic(creator, registry, null, salt);
                } catch (AddressOccupiedException e) {
                    return null;
                }
            }));
        }
        startLatch.countDown();

        List<Address> winners = new ArrayList<>();
        for (Future<Address> future : futures) {
            Address result = future.get(10, TimeUnit.SECONDS);
            if (result != null) {
                winners.add(result);
            }
        }
        executor.shutdown();

        assertEquals(List.of(factory.predictAddress(salt)), winners);
        assertEquals(1, factory.instanceCount());
    }

    @Test
    void concurrentCreatesAreAllRecorded() throws Exception {
        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Address>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return factory.create(CREATOR, registry, "Widget");
            }));
        }
        startLatch.countDown();

        List<Address> created = new ArrayList<>();
        for (Future<Address> future : futures) {
            created.add(future.get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertEquals(threadCount, created.stream().distinct().count());
        assertEquals(threadCount, factory.instanceCountOf(CREATOR));
        for (Address address : created) {
            assertEquals(InstanceState.INITIALIZED, factory.instance(address).orElseThrow().state());
        }
    }
}
