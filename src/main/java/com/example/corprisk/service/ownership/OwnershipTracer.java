package com.example.corprisk.service.ownership;

import com.example.corprisk.config.RegistryProperties;
import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.ownership.HolderKind;
import com.example.corprisk.model.ownership.OwnershipNode;
import com.example.corprisk.model.ownership.OwnershipTrace;
import com.example.corprisk.util.CompanyNumbers;
import com.example.corprisk.util.RegistryJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves who controls a company into a tree of control-holders.
 * <p>
 * Individuals, trusts and foreign corporates are leaves; a corporate with no registration
 * number counts as foreign. Domestic corporates are
 * expanded by fetching their own control-holders, down to {@code maxDepth}. The set of
 * visited companies is shared by the whole trace, so a company reached twice (a ring,
 * a self-reference or a diamond) is expanded only once and shows up as untraceable
 * the second time.
 */
@Component
public class OwnershipTracer {

    private static final Logger log = LoggerFactory.getLogger(OwnershipTracer.class);

    private final int maxDepth;

    @Autowired
    public OwnershipTracer(RegistryProperties properties) {
        this(properties.analysis().maxTraceDepth());
    }

    OwnershipTracer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public OwnershipTrace trace(RegistryClient registry, String companyNumber) {
        Set<String> visited = new LinkedHashSet<>();
        Level root = expand(registry, companyNumber, 0, visited);
        log.debug("Ownership trace for {} visited {} companies", companyNumber, visited.size());
        return new OwnershipTrace(companyNumber, root.layers(), new ArrayList<>(visited));
    }

    private record Level(List<OwnershipNode> layers, boolean untraceable) {
        static final Level UNTRACEABLE = new Level(List.of(), true);
    }

    private Level expand(RegistryClient registry, String companyNumber, int depth, Set<String> visited) {
        if (depth > maxDepth || !visited.add(companyNumber)) {
            return Level.UNTRACEABLE;
        }

        List<OwnershipNode> layers = new ArrayList<>();
        for (JsonNode psc : RegistryJson.items(registry.getPscs(companyNumber))) {
            if (RegistryJson.isCeased(psc)) continue;
            layers.add(classify(registry, psc, companyNumber, depth, visited));
        }
        return new Level(layers, false);
    }

    private OwnershipNode classify(RegistryClient registry, JsonNode psc, String companyNumber, int depth,
                                   Set<String> visited) {
        HolderKind kind = HolderKind.fromKind(RegistryJson.text(psc, "kind"));
        OwnershipNode.OwnershipNodeBuilder node = OwnershipNode.builder()
                .name(RegistryJson.text(psc, "name", "Unknown"))
                .kind(kind)
                .naturesOfControl(RegistryJson.strings(psc, "natures_of_control"))
                .depth(depth)
                .companyNumber(companyNumber);

        switch (kind) {
            case INDIVIDUAL:
                return node.terminal(true)
                        .nationality(RegistryJson.text(psc, "nationality"))
                        .build();
            case LEGAL_PERSON:
                return node.terminal(true).trust(true).build();
            case CORPORATE:
                return corporate(registry, psc, node, depth, visited);
            default:
                return node.terminal(true).build();
        }
    }

    private OwnershipNode corporate(RegistryClient registry, JsonNode psc, OwnershipNode.OwnershipNodeBuilder node,
                                    int depth, Set<String> visited) {
        JsonNode ident = psc.path("identification");
        String registration = RegistryJson.text(ident, "registration_number");
        String place = RegistryJson.text(ident, "place_registered");
        String country = RegistryJson.text(ident, "country_registered");
        node.registrationNumber(registration.isEmpty() ? null : registration)
                .jurisdiction((place + " " + country).trim());

        if (registration.isEmpty() || !isDomestic(registration, place, country)) {
            return node.terminal(true).foreign(true).build();
        }

        Level sub = expand(registry, registration, depth + 1, visited);
        return node.terminal(false)
                .subLayers(sub.layers())
                .untraceable(sub.untraceable())
                .build();
    }

    /** Registered with the home registry, judged by place, country or number shape. */
    static boolean isDomestic(String registration, String place, String country) {
        String p = place.toLowerCase(Locale.ROOT);
        String c = country.toLowerCase(Locale.ROOT);
        return p.contains("england")
                || p.contains("wales")
                || p.contains("companies house")
                || c.contains("united kingdom")
                || CompanyNumbers.isDomesticShape(registration);
    }
}
