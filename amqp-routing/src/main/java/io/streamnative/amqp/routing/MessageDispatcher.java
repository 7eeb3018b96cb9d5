/**
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
package io.streamnative.amqp.routing;

/**
 * Hands a routed message to the queue store. Implemented by the queue layer.
 */
@FunctionalInterface
public interface MessageDispatcher {

    MessageDispatcher NO_OP = (queue, message) -> {
    };

    /**
     * Deliver a message to a queue. Called once per destination queue of a publish.
     *
     * @param queue   name of the destination queue
     * @param message the published message
     */
    void dispatch(String queue, AmqpMessage message);

}
