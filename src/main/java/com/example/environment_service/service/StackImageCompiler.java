package com.example.environment_service.service;

import com.example.environment_service.adapter.AdapterRetryExecutor;
import com.example.environment_service.adapter.ClusterAdapter;
import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.SupportedStack;
import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.exception.ErrorKind;
import com.example.environment_service.exception.UnsupportedStackException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.CompiledImage;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceSpec;
import com.example.environment_service.model.StackConfig;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1ConfigMapVolumeSource;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Renders a stack configuration into a container build recipe and a content-addressed image tag,
 * and optionally hands the recipe to an in-cluster Kaniko build.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StackImageCompiler {

    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z0-9@/._=<>~^:+-]+");
    private static final Pattern ENV_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DESTRUCTIVE_RM = Pattern.compile("rm\\s+-rf\\s+/(\\s|\\*|$)", Pattern.MULTILINE);
    private static final List<String> DANGEROUS_FRAGMENTS = List.of("chmod 777", "sudo", "--privileged");
    private static final int TAG_HASH_LENGTH = 12;

    private final StackMatrix stackMatrix;
    private final ClusterAdapter clusterAdapter;
    private final AdapterRetryExecutor retryExecutor;
    private final OrchestrationProperties properties;

    public CompiledImage compile(StackConfig stack, String identity, boolean validateOnly) {
        if (stack == null) {
            throw new ValidationException(identity, "Stack configuration is required");
        }
        StackMatrix.Language language = stackMatrix.language(stack.getLanguage());
        if (language == null) {
            throw new UnsupportedStackException(identity, "Unsupported language: " + stack.getLanguage());
        }
        String baseImage = stack.getVersion() == null ? null : language.getVersions().get(stack.getVersion());
        if (baseImage == null) {
            throw new UnsupportedStackException(identity,
                    "Unsupported " + stack.getLanguage() + " version: " + stack.getVersion());
        }
        List<String> frameworkLines = List.of();
        if (stack.getFramework() != null && !stack.getFramework().isBlank()) {
            frameworkLines = language.getFrameworks().get(stack.getFramework());
            if (frameworkLines == null) {
                throw new UnsupportedStackException(identity,
                        "Unsupported " + stack.getLanguage() + " framework: " + stack.getFramework());
            }
        }

        String recipe = render(stack, baseImage, language, frameworkLines, identity);
        String imageTag = properties.getImage().getRegistry() + "/" + ManifestBuilder.slug(identity) + ":"
                + contentHash(recipe);

        if (validateOnly) {
            return new CompiledImage(recipe, imageTag, baseImage, false);
        }

        submitBuild(identity, recipe, imageTag);
        return new CompiledImage(recipe, imageTag, baseImage, true);
    }

    public List<SupportedStack> supportedStacks() {
        List<SupportedStack> stacks = new ArrayList<>();
        stackMatrix.languages().forEach((name, language) -> stacks.add(new SupportedStack(
                name, language.getVersions(), new ArrayList<>(language.getFrameworks().keySet()))));
        return stacks;
    }

    /**
     * Structural and safety checks on a rendered recipe.
     *
     * @return problems found, empty when the recipe is acceptable
     */
    public List<String> validateRecipe(String recipe) {
        List<String> problems = new ArrayList<>();
        if (recipe == null || recipe.isBlank()) {
            problems.add("Recipe is empty");
            return problems;
        }
        boolean hasFrom = recipe.lines().anyMatch(line -> line.strip().startsWith("FROM "));
        if (!hasFrom) {
            problems.add("Recipe must contain a FROM instruction");
        }
        if (!recipe.contains("WORKDIR ")) {
            problems.add("Recipe must contain a WORKDIR instruction");
        }
        if (DESTRUCTIVE_RM.matcher(recipe).find()) {
            problems.add("Potentially dangerous command detected: rm -rf /");
        }
        for (String fragment : DANGEROUS_FRAGMENTS) {
            if (recipe.contains(fragment)) {
                problems.add("Potentially dangerous command detected: " + fragment);
            }
        }
        return problems;
    }

    private String render(StackConfig stack, String baseImage, StackMatrix.Language language,
                          List<String> frameworkLines, String identity) {
        List<String> lines = new ArrayList<>();
        lines.add("# Workspace image: " + stack.getLanguage() + " " + stack.getVersion()
                + (hasFramework(stack) ? ", framework " + stack.getFramework() : ""));
        lines.add("FROM " + baseImage);
        lines.addAll(language.getSystem());
        lines.add("WORKDIR /workspace");
        lines.addAll(language.getSetup());
        lines.addAll(frameworkLines);

        List<String> packages = stack.getPackages() == null ? new ArrayList<>() : new ArrayList<>(stack.getPackages());
        if (!packages.isEmpty()) {
            for (String pkg : packages) {
                if (!PACKAGE_NAME.matcher(pkg).matches()) {
                    throw new ValidationException(identity, "Invalid package name: " + pkg);
                }
            }
            if (language.getPackageInstall() == null || language.getPackageInstall().isBlank()) {
                throw new UnsupportedStackException(identity,
                        "Extra packages are not supported for " + stack.getLanguage());
            }
            packages.sort(null);
            lines.add(language.getPackageInstall() + " " + String.join(" ", packages));
        }

        lines.add("ENV STACK_LANGUAGE=" + stack.getLanguage());
        lines.add("ENV STACK_VERSION=" + stack.getVersion());
        lines.add("ENV STACK_FRAMEWORK=" + (hasFramework(stack) ? stack.getFramework() : ""));
        Map<String, String> variables = stack.getEnvironmentVariables() == null
                ? Map.of() : new TreeMap<>(stack.getEnvironmentVariables());
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            if (!ENV_KEY.matcher(variable.getKey()).matches()) {
                throw new ValidationException(identity, "Invalid environment variable name: " + variable.getKey());
            }
            lines.add("ENV " + variable.getKey() + "=\"" + variable.getValue().replace("\"", "\\\"") + "\"");
        }
        lines.addAll(stackMatrix.tail());
        return String.join("\n", lines) + "\n";
    }

    private void submitBuild(String identity, String recipe, String imageTag) {
        String namespace = properties.getImage().getBuildNamespace();
        String buildName = "build-" + ManifestBuilder.slug(identity) + "-" + contentHash(recipe);
        Map<String, String> labels = Map.of(
                ManifestBuilder.LABEL_MANAGED_BY, ManifestBuilder.MANAGER,
                ManifestBuilder.LABEL_APP, buildName);

        V1ConfigMap configMap = new V1ConfigMap()
                .apiVersion("v1")
                .kind("ConfigMap")
                .metadata(new V1ObjectMeta().name(buildName).namespace(namespace).labels(labels))
                .data(Map.of("Dockerfile", recipe));

        V1Job job = new V1Job()
                .apiVersion("batch/v1")
                .kind("Job")
                .metadata(new V1ObjectMeta().name(buildName).namespace(namespace).labels(labels))
                .spec(new V1JobSpec()
                        .backoffLimit(2)
                        .ttlSecondsAfterFinished(3600)
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(labels))
                                .spec(new V1PodSpec()
                                        .restartPolicy("Never")
                                        .containers(List.of(new V1Container()
                                                .name("kaniko")
                                                .image(properties.getImage().getKanikoImage())
                                                .args(List.of(
                                                        "--dockerfile=/build/Dockerfile",
                                                        "--context=dir:///build",
                                                        "--destination=" + imageTag))
                                                .volumeMounts(List.of(new V1VolumeMount()
                                                        .name("build-context").mountPath("/build")))))
                                        .volumes(List.of(new V1Volume()
                                                .name("build-context")
                                                .configMap(new V1ConfigMapVolumeSource().name(buildName)))))));

        log.info("🔨 Submitting image build {} for '{}' -> {}", buildName, identity, imageTag);
        createIfAbsent(ResourceSpec.builder().kind(ResourceKind.CONFIG_MAP).namespace(namespace)
                .name(buildName).labels(labels).body(configMap).build());
        createIfAbsent(ResourceSpec.builder().kind(ResourceKind.JOB).namespace(namespace)
                .name(buildName).labels(labels).body(job).build());
    }

    // same recipe hash means the build was already submitted
    private void createIfAbsent(ResourceSpec spec) {
        try {
            retryExecutor.execute("create " + spec.describe(), () -> clusterAdapter.createResource(spec));
        } catch (AdapterException e) {
            if (e.getErrorKind() != ErrorKind.ADAPTER_CONFLICT) {
                throw e;
            }
            log.info("Build resource {} already exists", spec.describe());
        }
    }

    private static boolean hasFramework(StackConfig stack) {
        return stack.getFramework() != null && !stack.getFramework().isBlank();
    }

    static String contentHash(String recipe) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(recipe.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TAG_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
