package io.github.riemr.sampling.application.service;

import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.MasterData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 読み込み済みのマスタを保持する。差し替えは {@link #reload()} のみ。
 * 実行中の最適化は開始時に受け取ったインスタンスを使い続ける。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MasterDataHolder {

    private final MasterDataLoader loader;

    @Value("${assignment.data.workers-file:classpath:data/workers.csv}")
    private String workersFile;
    @Value("${assignment.data.tasks-file:classpath:data/tasks.csv}")
    private String tasksFile;
    @Value("${assignment.data.schedule-file:classpath:data/schedule.csv}")
    private String scheduleFile;
    @Value("${assignment.data.load-on-startup:true}")
    private boolean loadOnStartup;

    private final AtomicReference<MasterData> current = new AtomicReference<>();

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!loadOnStartup) {
            return;
        }
        try {
            reload();
        } catch (InvalidInputException e) {
            // 起動は継続し、初回アクセス時に再読み込みしてエラーを返す
            log.error("Master data could not be loaded at startup: {}", e.getMessage());
        }
    }

    /** 未読み込みなら読み込む */
    public MasterData get() {
        MasterData data = current.get();
        if (data == null) {
            data = reload();
        }
        return data;
    }

    public synchronized MasterData reload() {
        MasterData data = loader.load(workersFile, tasksFile, scheduleFile);
        current.set(data);
        return data;
    }
}
