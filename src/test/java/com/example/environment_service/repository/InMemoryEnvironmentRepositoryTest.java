package com.example.environment_service.repository;

import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEnvironmentRepositoryTest {

    private final InMemoryEnvironmentRepository repository = new InMemoryEnvironmentRepository();

    private Environment save(String id, String namespace, String userId) {
        return repository.save(Environment.builder()
                .id(id)
                .identity(namespace.substring(4))
                .namespace(namespace)
                .userId(userId)
                .state(EnvironmentState.RUNNING)
                .build());
    }

    @Test
    void findById_returnsCopy() {
        Environment saved = save("1", "env-alice", "alice");
        saved.setState(EnvironmentState.FAILED);

        Environment found = repository.findById("1").orElseThrow();
        found.setState(EnvironmentState.STOPPED);

        assertThat(repository.findById("1").orElseThrow().getState()).isEqualTo(EnvironmentState.RUNNING);
    }

    @Test
    void findByNamespacePrefix_isSortedByNamespace() {
        save("3", "env-lab-03", "u3");
        save("1", "env-lab-01", "u1");
        save("x", "env-other", "u4");
        save("2", "env-lab-02", "u2");

        assertThat(repository.findByNamespacePrefix("env-lab-"))
                .extracting(Environment::getNamespace)
                .containsExactly("env-lab-01", "env-lab-02", "env-lab-03");
    }

    @Test
    void findByUserId_andDelete() {
        save("1", "env-alice", "alice");
        save("2", "env-bob", "bob");

        assertThat(repository.findByUserId("alice")).extracting(Environment::getId).containsExactly("1");

        repository.delete("1");

        assertThat(repository.findById("1")).isEmpty();
        assertThat(repository.findAll()).hasSize(1);
    }
}
