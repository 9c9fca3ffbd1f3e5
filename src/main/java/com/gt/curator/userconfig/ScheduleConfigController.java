package com.gt.curator.userconfig;

import com.gt.curator.model.ScheduleConfig;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/scheduleConfig")
public class ScheduleConfigController {

    private final ScheduleConfigService scheduleConfigService;

    public ScheduleConfigController(ScheduleConfigService scheduleConfigService) {
        this.scheduleConfigService = scheduleConfigService;
    }

    @GetMapping
    public ScheduleConfig getScheduleConfig(@RequestParam(value = "learnerId") String learnerId) {
        return scheduleConfigService.getScheduleConfig(learnerId);
    }

    @PostMapping
    public ScheduleConfig updateScheduleConfig(@RequestParam(value = "learnerId") String learnerId,
                                               @RequestBody ScheduleConfigUpdate update) {
        return scheduleConfigService.updateScheduleConfig(learnerId, update);
    }
}
