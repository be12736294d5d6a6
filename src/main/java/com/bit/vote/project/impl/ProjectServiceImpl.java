package com.bit.vote.project.impl;

import com.bit.vote.common.Address;
import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.TableEnum;
import com.bit.vote.event.EventService;
import com.bit.vote.event.ProjectCreatedEvent;
import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import com.bit.vote.project.ProjectService;
import com.bit.vote.structure.project.Project;
import com.bit.vote.util.ByteUtils;
import com.bit.vote.voting.ReentrancyGuard;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.RemovalListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class ProjectServiceImpl implements ProjectService {

    static final byte[] PROJECT_COUNT_KEY = "#_projects".getBytes(StandardCharsets.UTF_8);

    private final DataBase dataBase;
    private final EventService eventService;
    private final ReentrancyGuard guard;
    private final Clock clock;
    private final Address admin;

    /**
     * 项目缓存 先查缓存再查数据库  项目ID -> 项目
     */
    private final LoadingCache<Long, Project> projectCache;

    public ProjectServiceImpl(DataBase dataBase,
                              EventService eventService,
                              ReentrancyGuard guard,
                              Clock clock,
                              @Qualifier("adminAddress") Address admin,
                              SystemConfig config) {
        this.dataBase = dataBase;
        this.eventService = eventService;
        this.guard = guard;
        this.clock = clock;
        this.admin = admin;
        this.projectCache = Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .removalListener((RemovalListener<Long, Project>) (id, project, cause) ->
                        log.debug("Project cache removed: id={}, cause={}", id, cause))
                .build(this::loadProject);// 缓存未命中时从数据库加载
    }

    @Override
    public long createProject(Address caller, String name, String description, long startTime, long duration) {
        ProjectCreatedEvent event = guard.call("createProject", () -> {
            if (!admin.equals(caller)) {
                log.warn("非管理员尝试创建项目 caller={}", caller);
                throw new VotingException(ErrorType.UNAUTHORIZED, "createProject");
            }
            long now = clock.instant().getEpochSecond();
            if (startTime <= now) {
                throw new VotingException(ErrorType.INVALID_SCHEDULE, "startTime=" + startTime + " now=" + now);
            }
            if (duration <= 0) {
                throw new VotingException(ErrorType.INVALID_SCHEDULE, "duration=" + duration);
            }
            long endTime;
            try {
                endTime = Math.addExact(startTime, duration);
            } catch (ArithmeticException e) {
                throw new VotingException(ErrorType.INVALID_SCHEDULE, "endTime溢出", e);
            }

            long id = getTotalProjects();
            Project project = new Project();
            project.setId(id);
            project.setName(name == null ? "" : name);
            project.setDescription(description == null ? "" : description);
            project.setStartTime(startTime);
            project.setEndTime(endTime);
            project.setActive(true);

            ProjectCreatedEvent created = new ProjectCreatedEvent(id, project.getName(), startTime, endTime, now);
            List<DbOperation> ops = new ArrayList<>();
            ops.add(stageSave(project));
            ops.add(DbOperation.put(TableEnum.META, PROJECT_COUNT_KEY, ByteUtils.longToBytes(id + 1)));
            ops.addAll(eventService.stage(created));
            if (!dataBase.dataTransaction(ops)) {
                throw new IllegalStateException("项目创建事务提交失败 id=" + id);
            }
            evict(id);
            log.info("项目创建成功 id={} name={} 窗口=[{}, {}]", id, project.getName(), startTime, endTime);
            return created;
        });
        eventService.publish(event);
        return event.getProjectId();
    }

    @Override
    public Project getProject(long id) {
        if (id < 0 || id >= getTotalProjects()) {
            throw new VotingException(ErrorType.NOT_FOUND, "id=" + id);
        }
        Project project = projectCache.get(id);
        if (project == null) {
            throw new VotingException(ErrorType.NOT_FOUND, "id=" + id);
        }
        return project.copy();
    }

    @Override
    public long getTotalProjects() {
        byte[] bytes = dataBase.get(TableEnum.META, PROJECT_COUNT_KEY);
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    @Override
    public DbOperation stageSave(Project project) {
        return DbOperation.put(TableEnum.PROJECT, ByteUtils.longToBytes(project.getId()), project.serialize());
    }

    @Override
    public void evict(long id) {
        projectCache.invalidate(id);
    }

    private Project loadProject(Long id) {
        byte[] bytes = dataBase.get(TableEnum.PROJECT, ByteUtils.longToBytes(id));
        return bytes == null ? null : Project.deserialize(bytes);
    }
}
