package com.myorg.lhub.ingestion.gateway;

import com.myorg.lhub.ingestion.gateway.dto.NamespaceCreateRequest;
import com.myorg.lhub.ingestion.gateway.dto.NamespaceUpdateRequest;
import com.myorg.lhub.ingestion.namespace.NamespaceConfig;
import com.myorg.lhub.ingestion.namespace.NamespaceService;
import com.myorg.lhub.ingestion.namespace.NamespaceUsage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/namespaces")
@RequiredArgsConstructor
public class NamespaceController {

    private final NamespaceService namespaces;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NamespaceConfig create(@RequestBody NamespaceCreateRequest req) {
        return namespaces.create(req);
    }

    @GetMapping
    public List<NamespaceConfig> list() {
        return namespaces.list();
    }

    @GetMapping("/{name}")
    public NamespaceConfig get(@PathVariable("name") String name) {
        return namespaces.get(name);
    }

    @PatchMapping("/{name}")
    public NamespaceConfig update(@PathVariable("name") String name, @RequestBody NamespaceUpdateRequest req) {
        return namespaces.update(name, req);
    }

    @GetMapping("/{name}/usage")
    public NamespaceUsage usage(@PathVariable("name") String name) {
        return namespaces.usage(name);
    }
}
