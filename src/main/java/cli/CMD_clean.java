package cli;

import config.HibernateUtil;
import config.StoreRole;
import config.StoreSettings;
import dao.CleanupDao;
import model.EntityKind;
import org.hibernate.SessionFactory;
import picocli.CommandLine;

import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "clean",
    header = "Delete every user, chat, membership and message",
    exitCodeList = {"0: success", "1: failure", "2: configuration error"})
public class CMD_clean implements Callable<Integer> {

    @CommandLine.Mixin
    private StoreOptions storeOptions = new StoreOptions();

    @CommandLine.Option(names = {"--yes"}, description = "Confirm the deletion", required = true)
    private boolean confirmed;

    @Override
    public Integer call() {
        StoreSettings settings = storeOptions.settings(StoreRole.READ_WRITE);
        SessionFactory sessionFactory = HibernateUtil.buildSessionFactory(settings);
        try {
            Map<EntityKind, Long> deleted = new CleanupDao(sessionFactory, settings).deleteAll();
            StringBuilder sb = new StringBuilder("Deleted:");
            deleted.forEach((kind, n) -> sb.append(' ').append(kind.label()).append('=').append(n));
            System.out.println(sb);
            return CommandSupport.EXIT_SUCCESS;
        } finally {
            HibernateUtil.shutdown(sessionFactory);
        }
    }
}
