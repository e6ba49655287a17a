package jump.email.watcher.controller;

import jump.email.watcher.model.HooksConfigView;
import jump.email.watcher.model.TriagePreset;
import jump.email.watcher.model.WatchTargetStatus;
import jump.email.watcher.service.HooksService;
import jump.email.watcher.service.WatcherService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the watcher and hooks.
 */
@RestController
@RequestMapping("/api")
public class WatcherController {
    private final WatcherService watcherService;
    private final HooksService hooksService;

    public WatcherController(WatcherService watcherService, HooksService hooksService) {
        this.watcherService = watcherService;
        this.hooksService = hooksService;
    }

    @GetMapping("/watcher/status")
    public List<WatchTargetStatus> getWatcherStatus() {
        return watcherService.getStatus();
    }

    @GetMapping("/hooks/config")
    public HooksConfigView getHooksConfig() {
        return hooksService.getHooksConfig();
    }

    /**
     * All presets, with the configured one marked active.
     */
    @GetMapping("/hooks/presets")
    public List<Map<String, Object>> listPresets() {
        TriagePreset active = hooksService.getHooksConfig().getPreset();
        List<Map<String, Object>> presets = new ArrayList<>();
        for (TriagePreset preset : TriagePreset.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", preset.getId());
            entry.put("name", preset.getDisplayName());
            entry.put("description", preset.getDescription());
            entry.put("suggestedLabels", preset.getSuggestedLabels());
            entry.put("active", preset == active);
            presets.add(entry);
        }
        return presets;
    }
}
