package com.gt.curator.userconfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class ScheduleConfigDao {

    private static final Logger log = LoggerFactory.getLogger(ScheduleConfigDao.class);

    private final NamedParameterJdbcTemplate template;

    @Autowired
    public ScheduleConfigDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    private static final String INSERT_SETTING_ROW =
            "INSERT INTO schedule_config (learner_id, setting_name, setting_value) " +
            "VALUES (:learnerId, :settingName, :settingValue) " +
            "ON CONFLICT (learner_id, setting_name) DO UPDATE " +
                    "SET setting_value = :settingValue";

    private static final String GET_SETTINGS_FOR_LEARNER =
            "SELECT setting_name, setting_value " +
            "FROM schedule_config " +
            "WHERE learner_id = :learnerId";

    public void saveSettings(String learnerId, Map<String, String> settings) {
        int index = 0;
        SqlParameterSource[] sources = new SqlParameterSource[settings.size()];

        for (Map.Entry<String, String> setting : settings.entrySet()) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            source.addValue("learnerId", learnerId);
            source.addValue("settingName", setting.getKey());
            source.addValue("settingValue", setting.getValue());

            sources[index++] = source;
        }

        template.batchUpdate(INSERT_SETTING_ROW, sources);
        log.info("Saved schedule settings {} for learner {}", settings.keySet(), learnerId);
    }

    public Map<String, String> getSettings(String learnerId) {
        return template.query(GET_SETTINGS_FOR_LEARNER, Map.of("learnerId", learnerId), (rs) -> {
            Map<String, String> settings = new HashMap<>();

            while (rs.next()) {
                String settingName = rs.getString("setting_name");
                String settingValue = rs.getString("setting_value");

                if (settingName != null && !settingName.isBlank() && settingValue != null && !settingValue.isBlank()) {
                    settings.put(settingName, settingValue);
                } else {
                    log.warn("Ignoring blank schedule setting '{}' for learner {}", settingName, learnerId);
                }
            }

            return settings;
        });
    }
}
