package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.application.port.in.DescribeFrameworkUseCase;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.domain.framework.ComponentKind;
import com.vidnyan.swivel.domain.framework.ComponentRole;
import com.vidnyan.swivel.domain.framework.FrameworkCatalogue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FrameworkInfoService implements DescribeFrameworkUseCase {

    private final FrameworkRuntime frameworkRuntime;

    @Override
    public FrameworkInfo describe() {
        ToolVersions versions = ToolVersions.detect(frameworkRuntime);
        List<String> unresolved = !frameworkRuntime.isAvailable()
                ? List.of()
                : FrameworkCatalogue.kinds().stream()
                        .filter(kind -> !resolvable(kind))
                        .map(ComponentKind::qualifiedName)
                        .toList();
        if (!unresolved.isEmpty()) {
            log.warn("Catalogue entries missing from the Swing runtime: {}", unresolved);
        }
        return new FrameworkInfo(
                frameworkRuntime.isAvailable(),
                versions.java(),
                versions.framework(),
                versions.platform(),
                FrameworkCatalogue.kinds().stream()
                        .filter(kind -> kind.role() != ComponentRole.CONTAINER && !kind.isLayout())
                        .map(ComponentKind::simpleName)
                        .sorted()
                        .toList(),
                names(ComponentRole.CONTAINER),
                names(ComponentRole.LAYOUT),
                unresolved);
    }

    private boolean resolvable(ComponentKind kind) {
        return frameworkRuntime.loadClass(kind.qualifiedName())
                .map(type -> kind.isLayout()
                        ? frameworkRuntime.isLayoutManager(type)
                        : frameworkRuntime.isComponent(type))
                .orElse(false);
    }

    private static List<String> names(ComponentRole role) {
        return FrameworkCatalogue.kinds(role).stream().map(ComponentKind::simpleName).sorted().toList();
    }
}
