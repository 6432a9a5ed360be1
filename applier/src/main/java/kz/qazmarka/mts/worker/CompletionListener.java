package kz.qazmarka.mts.worker;

/**
 * Канал отчётов о завершении. Единственный путь, которым исполнители влияют на
 * состояние планирования координатора.
 */
public interface CompletionListener {

    void onCompletion(CompletionReport report);
}
