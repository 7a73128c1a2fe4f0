/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.autoheal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.dto.RunRequest;
import org.tarik.autoheal.dto.TaskConfig;
import org.tarik.autoheal.exceptions.ConfigurationException;
import org.tarik.autoheal.manager.DailySpendTracker;
import org.tarik.autoheal.manager.RunStore;
import org.tarik.autoheal.orchestrator.AutomationOrchestrator;

import java.util.Map;

import static io.javalin.Javalin.create;
import static org.tarik.autoheal.AgentConfig.getStartPort;
import static org.tarik.autoheal.utils.CommonUtils.isBlank;
import static org.tarik.autoheal.utils.JsonUtils.createObjectMapper;

public class Server {
    private static final Logger LOG = LoggerFactory.getLogger(Server.class);
    private static final long MAX_REQUEST_SIZE = 1_000_000;
    private static final String RUNS_PATH = "/runs";
    private static final String TASK_ID_PARAM = "taskId";
    private static final String RUN_PATH = RUNS_PATH + "/{" + TASK_ID_PARAM + "}";
    private static final String BUDGET_PATH = "/budget";
    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    public static void main(String[] args) {
        int port = getStartPort();
        String host = AgentConfig.getHost();
        createApp(Agent.getOrchestrator(), Agent.getDailySpendTracker(), Agent.getRunStore()).start(host, port);
        LOG.info("Agent server started on host {} and port {}", host, port);
    }

    public static Javalin createApp(AutomationOrchestrator orchestrator, DailySpendTracker dailySpendTracker,
                                    RunStore runStore) {
        return create(config -> {
            config.http.maxRequestSize = MAX_REQUEST_SIZE;
            config.jsonMapper(new JavalinJackson(OBJECT_MAPPER, false));
        })
                .post(RUNS_PATH, ctx -> {
                    var task = parseRunRequest(ctx).toTask(TaskConfig.defaults());
                    ctx.json(orchestrator.execute(task));
                })
                .get(RUN_PATH, ctx -> {
                    var taskId = ctx.pathParam(TASK_ID_PARAM);
                    runStore.load(taskId).ifPresentOrElse(ctx::json, () -> ctx.status(404)
                            .json(Map.of("error", "No finished run for task '%s'".formatted(taskId))));
                })
                .get(BUDGET_PATH, ctx -> ctx.json(dailySpendTracker.getReport()))
                .exception(ConfigurationException.class, (e, ctx) -> {
                    LOG.warn("Rejected run request: {}", e.getMessage());
                    ctx.status(400).json(Map.of("error", e.getMessage()));
                });
    }

    private static RunRequest parseRunRequest(Context ctx) {
        var body = ctx.body();
        if (isBlank(body)) {
            throw new ConfigurationException("Request body must contain a task");
        }
        try {
            return OBJECT_MAPPER.readValue(body, RunRequest.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Request body is not a valid task: %s".formatted(e.getOriginalMessage()),
                    e);
        }
    }
}
